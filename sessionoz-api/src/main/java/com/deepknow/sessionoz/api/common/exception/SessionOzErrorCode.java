package com.deepknow.sessionoz.api.common.exception;

/**
 * SessionOz 统一错误码
 */
public enum SessionOzErrorCode {

    // 参数错误
    INVALID_PARAM("SYS_001", "非法参数"),

    // 类型化存储错误
    SERIALIZE_FAILED("STG_001", "会话数据序列化失败"),
    DESERIALIZE_FAILED("STG_002", "会话数据反序列化失败"),

    // 会话生命周期错误
    SESSION_DESTROYED("SES_001", "会话已销毁"),
    SESSION_STORAGE_ERROR("SES_002", "会话存储操作失败"),

    // 后端存储错误
    STORE_UNAVAILABLE("STO_001", "会话存储后端不可用"),
    STORE_CORRUPT_ENTRY("STO_002", "会话存储条目已损坏"),
    STORE_KEY_EXHAUSTED("STO_003", "无法生成未被占用的会话 Key"),
    STORE_ENCODE_FAILED("STO_004", "会话状态编码失败");

    private final String code;
    private final String message;

    SessionOzErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
