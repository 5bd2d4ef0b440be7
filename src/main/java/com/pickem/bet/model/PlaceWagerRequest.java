package com.pickem.bet.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaceWagerRequest {
    private Long eventId;
    private String pick;
    private BigDecimal stake;
}
