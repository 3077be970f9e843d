package com.bit.hydro.structure.dto;

import com.bit.hydro.structure.constants.Constants;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class UpdateConstantsRequest extends LedgerRequest {
    private long activationTimestamp;
    private Constants constants;
}
