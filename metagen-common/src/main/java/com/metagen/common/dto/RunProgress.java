package com.metagen.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 运行进度快照。completed 单调不减。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunProgress {

    private String runId;

    private int completed;

    private int total;

    private int succeeded;

    private int failed;

    /** 最近派发的文件 */
    private String currentFile;

    private RunStatus status;
}
