package com.bit.hydro.structure.dto;

import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class UpdateTokenRatioRequest extends LedgerRequest {
    private String tokenGroupId;
    private BigDecimal ratio;
}
