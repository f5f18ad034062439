package com.lvfield.equiptrack.dto.reconcile;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 被跳过的非法行 (缺名称 / 缺数量)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RowIssue {

    /** 行号，从 1 开始 */
    private int rowNumber;

    private String rowName;

    private String reason;
}
