package com.pickem.bet.model;

import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.WagerStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WagerView {
    private String id;
    private String userId;
    private Long eventId;
    private String pick;
    private BigDecimal stake;
    private BigDecimal potentialPayout;
    private BigDecimal realizedPayout;
    private WagerStatus status;
    private Instant placedAt;
    private Instant settledAt;

    public static WagerView from(Wager wager) {
        return WagerView.builder()
                .id(wager.getId())
                .userId(wager.getUserId())
                .eventId(wager.getEventId())
                .pick(wager.getPick())
                .stake(wager.getStake())
                .potentialPayout(wager.getPotentialPayout())
                .realizedPayout(wager.getRealizedPayout())
                .status(wager.getStatus())
                .placedAt(wager.getPlacedAt())
                .settledAt(wager.getSettledAt())
                .build();
    }
}
