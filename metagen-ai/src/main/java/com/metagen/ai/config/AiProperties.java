package com.metagen.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AI 模块配置项（OpenAI 兼容接口）。
 */
@Data
@ConfigurationProperties(prefix = "metagen.ai")
public class AiProperties {

    /** 接口根地址，OpenAI / Groq / OpenRouter 等兼容服务均可 */
    private String baseUrl = "https://api.openai.com/v1";

    private String model = "gpt-4o-mini";

    private double temperature = 0.3;

    private int maxTokens = 1024;

    /** 凭证探测路径，GET 返回 2xx 即视为凭证有效 */
    private String probePath = "/models";

    /** 建立连接的超时时间（秒），整体调用超时由调度模块按次指定 */
    private int connectTimeoutSeconds = 10;
}
