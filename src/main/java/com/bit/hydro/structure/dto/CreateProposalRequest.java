package com.bit.hydro.structure.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class CreateProposalRequest extends LedgerRequest {
    private long trancheId;
    private String title;
    private String description;
    private long deploymentDuration;
}
