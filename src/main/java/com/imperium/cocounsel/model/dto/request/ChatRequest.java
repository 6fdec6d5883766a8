package com.imperium.cocounsel.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 对话请求，对应 POST /api/v0/ai/chat。调用者身份由 X-User-Id 头给出。
 */
@Data
public class ChatRequest {

    /** 必填，1~8000 字符 */
    @NotBlank(message = "message is required")
    @Size(max = 8000, message = "message length must be 1~8000")
    private String message;

    /** 必填，会话ID */
    @NotBlank(message = "sessionId is required")
    @Size(max = 128, message = "sessionId length must be 1~128")
    private String sessionId;

    /** 可选，案件ID */
    private Long caseId;

    /** 法域：kansas | missouri | federal | both（可选，默认 both） */
    @Pattern(regexp = "^(?i)(kansas|missouri|federal|both)?$",
            message = "jurisdiction must be one of: kansas, missouri, federal, both")
    private String jurisdiction;
}
