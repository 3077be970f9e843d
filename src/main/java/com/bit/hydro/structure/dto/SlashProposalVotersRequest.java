package com.bit.hydro.structure.dto;

import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SlashProposalVotersRequest extends LedgerRequest {
    private long roundId;
    private long trancheId;
    private long proposalId;
    private BigDecimal slashPercent;
    private long startFrom;
    private long limit;
}
