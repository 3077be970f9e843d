package com.bit.hydro.structure.vote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProposalToLockups {
    private long proposalId;
    private List<Long> lockIds;
}
