package com.bit.hydro.structure.dto;

import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class UnvoteRequest extends LedgerRequest {
    private long trancheId;
    private List<Long> lockIds;
}
