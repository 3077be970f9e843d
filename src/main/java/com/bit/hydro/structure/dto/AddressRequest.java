package com.bit.hydro.structure.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class AddressRequest extends LedgerRequest {
    private String address;
}
