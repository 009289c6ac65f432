package com.asiainfo.kpietl.domain.model;

import java.time.LocalDateTime;

/**
 * 源表原始行 (date_heure, ID_indicateur, valeur)，indicatorId 可能为 null
 */
public record RawCounterRow(LocalDateTime timestamp, Long indicatorId, Double value) {
}
