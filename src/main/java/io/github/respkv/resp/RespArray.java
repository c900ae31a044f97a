package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public class RespArray implements RespData {
    static final char firstChar = '*';

    private final List<RespData> datas;

    public static RespArray empty() {
        return new RespArray(Collections.emptyList());
    }

    public static RespArray with(List<? extends RespData> datas) {
        return new RespArray(new ArrayList<>(datas));
    }

    public static RespArray with(RespData... datas) {
        return new RespArray(Arrays.asList(datas));
    }

    private RespArray(List<RespData> datas) {
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public <T extends RespData> T get(int i) {
        return (T) datas.get(i);
    }

    public List<RespData> getDatas() {
        return Collections.unmodifiableList(datas);
    }

    @Override
    public byte[] toBytes() {
        byte[] bytes = (firstChar + String.valueOf(datas.size()) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        for (RespData data : datas) {
            bytes = Bytes.concat(bytes, data.toBytes());
        }
        return bytes;
    }
}
