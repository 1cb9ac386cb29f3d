package com.monotrack.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Denormalized currency data stored next to every account and transaction.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class CurrencyInfo {
  @Column(name = "currency_code")
  private Integer code;

  @Column(name = "currency_name", length = 16)
  private String name;

  @Column(name = "currency_symbol", length = 8)
  private String symbol;

  @Column(name = "currency_flag", length = 16)
  private String flag;
}
