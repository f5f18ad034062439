package com.lvfield.equiptrack.dto.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * 重导入请求体
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReimportRequest {

    /** 原始文件名，只用于批次记录 */
    private String filename;

    private List<ParsedRow> rows;
}
