package com.bit.hydro.structure.constants;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LockPowerEntry {
    private long lockedRounds;
    private BigDecimal powerScalingFactor;
}
