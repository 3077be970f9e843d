package com.bit.hydro.service.impl;

import com.bit.hydro.config.HydroConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.snapshot.SnapshotMap;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.service.GovernanceService;
import com.bit.hydro.store.AccessStore;
import com.bit.hydro.store.ConstantsStore;
import com.bit.hydro.store.MetadataStore;
import com.bit.hydro.store.ProposalStore;
import com.bit.hydro.store.RoundPowerAggregator;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.proposal.Tranche;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

@Slf4j
@Service
public class GovernanceServiceImpl implements GovernanceService {

    @Autowired
    private MetadataStore metadataStore;

    @Autowired
    private ConstantsStore constantsStore;

    @Autowired
    private AccessStore accessStore;

    @Autowired
    private ProposalStore proposalStore;

    @Autowired
    private RoundPowerAggregator roundPowerAggregator;

    @Override
    public void instantiate(DataBase db, HydroConfig config) {
        Constants constants = config.initialConstants();
        validateConstants(constants);
        constantsStore.save(db, constants.getFirstRoundStart(), constants);

        for (String admin : config.getWhitelistAdmins()) {
            accessStore.addAdmin(db, admin);
        }
        for (HydroConfig.TrancheInfo info : config.getTranches()) {
            if (proposalStore.trancheNameExists(db, info.getName())) {
                throw HydroException.validation("Tranche with name " + info.getName() + " already exists");
            }
            proposalStore.saveTranche(db, new Tranche(metadataStore.nextTrancheId(db), info.getName(),
                    info.getMetadata()));
        }
        SnapshotMap.markActivationHeight(db, config.getInitHeight());
        metadataStore.markInitialized(db);
    }

    @Override
    public void updateConstants(LedgerContext context, long activationTimestamp, Constants constants) {
        accessStore.validateAdmin(context.getDb(), context.sender());
        if (activationTimestamp < context.now()) {
            throw HydroException.validation("Can not update constants in the past.");
        }
        if (constants.getFirstRoundStart() != context.getConstants().getFirstRoundStart()
                || constants.getRoundLength() != context.getConstants().getRoundLength()) {
            throw HydroException.validation("First round start and round length can not be changed.");
        }
        validateConstants(constants);
        constantsStore.save(context.getDb(), activationTimestamp, constants);
        log.info("配置更新, 生效时间: {}", activationTimestamp);
    }

    @Override
    public void pause(LedgerContext context) {
        accessStore.validateAdmin(context.getDb(), context.sender());
        Constants paused = context.getConstants().toBuilder().paused(true).build();
        constantsStore.save(context.getDb(), context.now(), paused);
        log.info("账本已暂停, height={}", context.height());
    }

    @Override
    public void addToWhitelist(LedgerContext context, String address) {
        accessStore.validateAdmin(context.getDb(), context.sender());
        if (accessStore.isWhitelisted(context.getDb(), address)) {
            throw HydroException.validation("Address already in whitelist");
        }
        accessStore.addToWhitelist(context.getDb(), address);
    }

    @Override
    public void removeFromWhitelist(LedgerContext context, String address) {
        accessStore.validateAdmin(context.getDb(), context.sender());
        accessStore.removeFromWhitelist(context.getDb(), address);
    }

    @Override
    public Tranche addTranche(LedgerContext context, String name, String metadata) {
        DataBase db = context.getDb();
        accessStore.validateAdmin(db, context.sender());
        if (name == null || name.isBlank()) {
            throw HydroException.validation("Tranche name can not be empty");
        }
        if (proposalStore.trancheNameExists(db, name)) {
            throw HydroException.validation("Tranche with name " + name + " already exists");
        }
        Tranche tranche = new Tranche(metadataStore.nextTrancheId(db), name, metadata == null ? "" : metadata);
        proposalStore.saveTranche(db, tranche);
        log.info("新增 tranche, id={}, name={}", tranche.getId(), name);
        return tranche;
    }

    @Override
    public Proposal createProposal(LedgerContext context, long trancheId, String title, String description,
                                   long deploymentDuration) {
        DataBase db = context.getDb();
        context.ensureNotPaused();
        if (!accessStore.isWhitelisted(db, context.sender()) && !accessStore.isAdmin(db, context.sender())) {
            throw HydroException.unauthorized("Unauthorized");
        }
        proposalStore.requireTranche(db, trancheId);
        if (deploymentDuration < 1) {
            throw HydroException.validation("Deployment duration must be at least 1 round");
        }
        Proposal proposal = new Proposal(context.getCurrentRound(), trancheId, metadataStore.nextProposalId(db),
                title, description, deploymentDuration, BigInteger.ZERO);
        proposalStore.saveProposal(db, proposal);
        log.info("创建提案, round={}, tranche={}, proposal={}", proposal.getRoundId(), trancheId,
                proposal.getProposalId());
        return proposal;
    }

    @Override
    public List<String> whitelist(LedgerContext context) {
        return accessStore.whitelist(context.getDb());
    }

    @Override
    public List<String> whitelistAdmins(LedgerContext context) {
        return accessStore.admins(context.getDb());
    }

    @Override
    public List<Tranche> tranches(LedgerContext context) {
        return proposalStore.tranches(context.getDb());
    }

    @Override
    public Proposal proposal(LedgerContext context, long roundId, long trancheId, long proposalId) {
        return proposalStore.requireProposal(context.getDb(), roundId, trancheId, proposalId);
    }

    @Override
    public List<Proposal> roundProposals(LedgerContext context, long roundId, long trancheId) {
        return proposalStore.roundProposals(context.getDb(), roundId, trancheId);
    }

    @Override
    public BigInteger roundTotalPower(LedgerContext context, long roundId) {
        return roundPowerAggregator.totalPowerOrZero(context.getDb(), roundId);
    }

    @Override
    public BigInteger roundTotalPowerAtHeight(LedgerContext context, long roundId, long height) {
        return roundPowerAggregator.totalPowerAtHeight(context.getDb(), roundId, height);
    }

    private static void validateConstants(Constants constants) {
        if (constants.getRoundLength() <= 0 || constants.getLockEpochLength() <= 0) {
            throw HydroException.validation("Round length and lock epoch length must be positive");
        }
        if (constants.getRoundLockPowerSchedule() == null
                || constants.getRoundLockPowerSchedule().getEntries().isEmpty()) {
            throw HydroException.validation("Round lock power schedule can not be empty");
        }
        BigDecimal threshold = constants.getSlashPercentageThreshold();
        if (threshold == null || threshold.signum() <= 0 || threshold.compareTo(BigDecimal.ONE) > 0) {
            throw HydroException.validation("Slash percentage threshold must be between 0 (exclusive) and 1 (inclusive)");
        }
        if (constants.getSlashTokensReceiverAddr() == null || constants.getSlashTokensReceiverAddr().isEmpty()) {
            throw HydroException.validation("Slash tokens receiver address must be set");
        }
        if (constants.getMaxLockedTokens() == null || constants.getMaxLockedTokens().signum() < 0) {
            throw HydroException.validation("Max locked tokens must not be negative");
        }
    }
}
