package com.bit.hydro.structure.dto;

import com.bit.hydro.structure.vote.ProposalToLockups;

import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class VoteRequest extends LedgerRequest {
    private long trancheId;
    private List<ProposalToLockups> proposals;
}
