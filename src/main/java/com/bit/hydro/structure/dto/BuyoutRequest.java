package com.bit.hydro.structure.dto;

import com.bit.hydro.structure.lock.Coin;

import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class BuyoutRequest extends LedgerRequest {
    private long lockId;
    private List<Coin> funds;
}
