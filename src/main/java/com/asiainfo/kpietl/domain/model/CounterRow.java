package com.asiainfo.kpietl.domain.model;

import java.time.LocalDateTime;

/**
 * 中间库行 (Date, indicateur, valeur)，指标ID已替换为指标名称
 */
public record CounterRow(LocalDateTime timestamp, String indicator, Double value) {
}
