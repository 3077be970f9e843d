package com.bit.hydro.structure.dto;

import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class LockIdsRequest extends LedgerRequest {
    private List<Long> lockIds;
}
