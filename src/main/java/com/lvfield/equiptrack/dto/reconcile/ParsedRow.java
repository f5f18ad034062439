package com.lvfield.equiptrack.dto.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 方案书解析器输出的一行
 * 方案书里多余的列在这里直接丢弃 (ignoreUnknown)，不会继续往下传
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParsedRow {

    private String roomName;

    /**
     * room_end / head_end / unspecified，为空时按房间推断
     */
    private String installationSide;

    /**
     * 外部料号
     */
    private String catalogPartId;

    private String name;

    private Integer quantity;

    private BigDecimal unitCost;

    private String supplierName;

    @JsonProperty("isLabor")
    private boolean labor;

    // --- 可选字段 ---

    private String description;

    private String manufacturer;

    private String model;
}
