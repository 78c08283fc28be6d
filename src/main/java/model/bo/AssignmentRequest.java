package model.bo;

import lombok.Value;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * 一次呼梯请求的业务对象
 */
@Value
public class AssignmentRequest {
    int fromFloor;
    int toFloor;
    String callerId;
    String idempotencyKey;   // 可为空

    /**
     * 请求指纹：只由起止楼层决定，呼梯方标识不参与
     */
    public String fingerprint() {
        String payload = fromFloor + "->" + toFloor;
        return DigestUtils.md5DigestAsHex(payload.getBytes(StandardCharsets.UTF_8));
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }
}
