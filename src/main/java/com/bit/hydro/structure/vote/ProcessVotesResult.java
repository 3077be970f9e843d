package com.bit.hydro.structure.vote;

import com.bit.hydro.structure.power.ProposalPowerChanges;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ProcessVotesResult {
    private List<Long> votedLockIds = new ArrayList<>();
    private List<Long> skippedLockIds = new ArrayList<>();
    private ProposalPowerChanges powerChanges = new ProposalPowerChanges();
}
