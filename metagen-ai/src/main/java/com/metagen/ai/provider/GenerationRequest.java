package com.metagen.ai.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个文件的生成请求：提示词加可选的图片内容。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    private String fileName;

    private String prompt;

    /** 图片 Base64，为空时只发送文字 */
    private String imageBase64;

    /** 为空时按文件名推断 */
    private String mimeType;
}
