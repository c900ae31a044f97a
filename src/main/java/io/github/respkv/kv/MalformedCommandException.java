package io.github.respkv.kv;

/**
 * 请求不是合法的命令帧：不是array，参数个数不对，或者参数格式错误。
 * @author zy
 */
public class MalformedCommandException extends Exception {
    private static final long serialVersionUID = -2841927263047790715L;

    public MalformedCommandException(String message) {
        super(message);
    }
}
