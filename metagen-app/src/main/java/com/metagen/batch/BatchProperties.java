package com.metagen.batch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 命令行批处理配置。未设置 input-dir 时不启动批处理。
 */
@Data
@ConfigurationProperties(prefix = "metagen.batch")
public class BatchProperties {

    /** 待处理文件所在目录 */
    private String inputDir;

    /** 结果输出文件（JSON），为空则只打印日志 */
    private String outputFile;

    /** 每个文件使用的提示词 */
    private String prompt = "Analyze this file and provide a title, a description and comma-separated keywords.";
}
