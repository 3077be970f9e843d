package com.bit.hydro.structure.dto;

import com.bit.hydro.structure.lock.Coin;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class LockTokensRequest extends LedgerRequest {
    private Coin funds;
    private long lockDuration;
}
