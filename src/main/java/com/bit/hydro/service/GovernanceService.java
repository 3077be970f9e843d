package com.bit.hydro.service;

import com.bit.hydro.config.HydroConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.proposal.Tranche;

import java.math.BigInteger;
import java.util.List;

/**
 * 配置、管理员白名单、tranche 与提案
 */
public interface GovernanceService {

    void instantiate(DataBase db, HydroConfig config);

    void updateConstants(LedgerContext context, long activationTimestamp, Constants constants);

    void pause(LedgerContext context);

    void addToWhitelist(LedgerContext context, String address);

    void removeFromWhitelist(LedgerContext context, String address);

    Tranche addTranche(LedgerContext context, String name, String metadata);

    Proposal createProposal(LedgerContext context, long trancheId, String title, String description,
                            long deploymentDuration);

    List<String> whitelist(LedgerContext context);

    List<String> whitelistAdmins(LedgerContext context);

    List<Tranche> tranches(LedgerContext context);

    Proposal proposal(LedgerContext context, long roundId, long trancheId, long proposalId);

    List<Proposal> roundProposals(LedgerContext context, long roundId, long trancheId);

    BigInteger roundTotalPower(LedgerContext context, long roundId);

    BigInteger roundTotalPowerAtHeight(LedgerContext context, long roundId, long height);
}
