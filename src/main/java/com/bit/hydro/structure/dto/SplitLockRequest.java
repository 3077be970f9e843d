package com.bit.hydro.structure.dto;

import java.math.BigInteger;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SplitLockRequest extends LedgerRequest {
    private long lockId;
    private BigInteger amount;
}
