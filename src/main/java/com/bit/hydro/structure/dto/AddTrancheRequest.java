package com.bit.hydro.structure.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class AddTrancheRequest extends LedgerRequest {
    private String name;
    private String metadata;
}
