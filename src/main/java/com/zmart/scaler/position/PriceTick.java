package com.zmart.scaler.position;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Market price update for one instrument, as delivered by the market-data feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceTick {

    private BigDecimal currentPrice;
    private LocalDateTime timestamp;

    public static PriceTick of(BigDecimal price) {
        return new PriceTick(price, LocalDateTime.now());
    }

    public static PriceTick of(String price) {
        return of(new BigDecimal(price));
    }
}
