package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.power.ProposalPowerChanges;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.proposal.Tranche;
import com.bit.hydro.token.TokenRatioOracle;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.DecimalUtil;
import com.bit.hydro.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * tranche、提案，以及每个提案按代币组累计的份额和总投票权
 */
@Slf4j
@Component
public class ProposalStore {

    // ---------------- tranche ----------------

    public void saveTranche(DataBase db, Tranche tranche) {
        db.insert(TableEnum.TRANCHE, ByteUtils.longToBytes(tranche.getId()), JsonUtil.toBytes(tranche));
    }

    public Optional<Tranche> loadTranche(DataBase db, long trancheId) {
        byte[] bytes = db.get(TableEnum.TRANCHE, ByteUtils.longToBytes(trancheId));
        return bytes == null ? Optional.empty() : Optional.of(JsonUtil.fromBytes(bytes, Tranche.class));
    }

    public Tranche requireTranche(DataBase db, long trancheId) {
        return loadTranche(db, trancheId).orElseThrow(() -> HydroException.notFound("Tranche does not exist"));
    }

    public List<Tranche> tranches(DataBase db) {
        List<Tranche> result = new ArrayList<>();
        for (DataBase.KeyValue<byte[]> kv : db.rangeQuery(TableEnum.TRANCHE, null, null)) {
            result.add(JsonUtil.fromBytes(kv.getValue(), Tranche.class));
        }
        return result;
    }

    public List<Long> trancheIds(DataBase db) {
        List<Long> result = new ArrayList<>();
        for (DataBase.KeyValue<byte[]> kv : db.rangeQuery(TableEnum.TRANCHE, null, null)) {
            result.add(ByteUtils.bytesToLong(kv.getKey()));
        }
        return result;
    }

    public boolean trancheNameExists(DataBase db, String name) {
        return tranches(db).stream().anyMatch(tranche -> tranche.getName().equals(name));
    }

    // ---------------- proposal ----------------

    public void saveProposal(DataBase db, Proposal proposal) {
        db.insert(TableEnum.PROPOSAL,
                ByteUtils.combine(proposal.getRoundId(), proposal.getTrancheId(), proposal.getProposalId()),
                JsonUtil.toBytes(proposal));
    }

    public Optional<Proposal> loadProposal(DataBase db, long roundId, long trancheId, long proposalId) {
        byte[] bytes = db.get(TableEnum.PROPOSAL, ByteUtils.combine(roundId, trancheId, proposalId));
        return bytes == null ? Optional.empty() : Optional.of(JsonUtil.fromBytes(bytes, Proposal.class));
    }

    public Proposal requireProposal(DataBase db, long roundId, long trancheId, long proposalId) {
        return loadProposal(db, roundId, trancheId, proposalId).orElseThrow(() -> HydroException.notFound(
                "proposal with id " + proposalId + " in round " + roundId + " and tranche " + trancheId
                        + " does not exist"));
    }

    public List<Proposal> roundProposals(DataBase db, long roundId, long trancheId) {
        byte[] prefix = ByteUtils.combine(roundId, trancheId);
        List<Proposal> result = new ArrayList<>();
        for (DataBase.KeyValue<byte[]> kv : db.rangeQuery(TableEnum.PROPOSAL, prefix, ByteUtils.prefixEnd(prefix))) {
            result.add(JsonUtil.fromBytes(kv.getValue(), Proposal.class));
        }
        return result;
    }

    // ---------------- 提案投票权 ----------------

    public BigDecimal proposalShares(DataBase db, long proposalId, String tokenGroupId) {
        byte[] bytes = db.get(TableEnum.PROPOSAL_SCALED_SHARES, sharesKey(proposalId, tokenGroupId));
        return bytes == null ? DecimalUtil.ZERO : decimal(bytes);
    }

    public BigDecimal proposalTotalPower(DataBase db, long proposalId) {
        byte[] bytes = db.get(TableEnum.PROPOSAL_TOTAL_POWER, ByteUtils.longToBytes(proposalId));
        return bytes == null ? DecimalUtil.ZERO : decimal(bytes);
    }

    /**
     * 把累计的份额变化写入提案：份额按代币组加减，总投票权按本轮比率加减，proposal.power = ceil(总投票权)
     * 份额或总投票权变为负数时报错
     */
    public void applyProposalChanges(DataBase db, TokenRatioOracle oracle, long roundId, long trancheId,
                                     ProposalPowerChanges changes) {
        for (Map.Entry<Long, Map<String, BigDecimal>> entry : changes.effective().entrySet()) {
            long proposalId = entry.getKey();
            BigDecimal totalPower = proposalTotalPower(db, proposalId);

            for (Map.Entry<String, BigDecimal> groupChange : entry.getValue().entrySet()) {
                String group = groupChange.getKey();
                BigDecimal delta = groupChange.getValue();
                BigDecimal ratio = oracle.getTokenGroupRatio(roundId, group);

                BigDecimal updatedShares = proposalShares(db, proposalId, group).add(delta);
                if (updatedShares.signum() < 0) {
                    throw HydroException.arithmetic("Shares for a token group cannot be negative");
                }
                saveDecimal(db, TableEnum.PROPOSAL_SCALED_SHARES, sharesKey(proposalId, group), updatedShares);

                totalPower = totalPower.add(delta.multiply(ratio)).setScale(DecimalUtil.SCALE, RoundingMode.DOWN);
                if (totalPower.signum() < 0) {
                    throw HydroException.arithmetic("Total power cannot be negative");
                }
            }
            saveDecimal(db, TableEnum.PROPOSAL_TOTAL_POWER, ByteUtils.longToBytes(proposalId), totalPower);
            refreshProposalPower(db, roundId, trancheId, proposalId);
        }
    }

    /**
     * 代币组比率变化后重算本轮所有提案的总投票权
     */
    public void applyRatioChange(DataBase db, long roundId, String tokenGroupId, BigDecimal oldRatio,
                                 BigDecimal newRatio) {
        for (Long trancheId : trancheIds(db)) {
            for (Proposal proposal : roundProposals(db, roundId, trancheId)) {
                BigDecimal shares = proposalShares(db, proposal.getProposalId(), tokenGroupId);
                if (shares.signum() == 0) {
                    continue;
                }
                BigDecimal totalPower = proposalTotalPower(db, proposal.getProposalId())
                        .subtract(shares.multiply(oldRatio))
                        .add(shares.multiply(newRatio))
                        .setScale(DecimalUtil.SCALE, RoundingMode.DOWN);
                if (totalPower.signum() < 0) {
                    throw HydroException.arithmetic("Total power cannot be negative");
                }
                saveDecimal(db, TableEnum.PROPOSAL_TOTAL_POWER, ByteUtils.longToBytes(proposal.getProposalId()),
                        totalPower);
                refreshProposalPower(db, roundId, trancheId, proposal.getProposalId());
            }
        }
    }

    private void refreshProposalPower(DataBase db, long roundId, long trancheId, long proposalId) {
        Optional<Proposal> proposal = loadProposal(db, roundId, trancheId, proposalId);
        if (proposal.isEmpty()) {
            log.warn("提案不存在，跳过投票权更新, round={}, tranche={}, proposal={}", roundId, trancheId, proposalId);
            return;
        }
        Proposal updated = proposal.get();
        updated.setPower(DecimalUtil.ceil(proposalTotalPower(db, proposalId)));
        saveProposal(db, updated);
    }

    private static byte[] sharesKey(long proposalId, String tokenGroupId) {
        return ByteUtils.combine(ByteUtils.longToBytes(proposalId), ByteUtils.stringSegment(tokenGroupId));
    }

    private static BigDecimal decimal(byte[] bytes) {
        return new BigDecimal(new String(bytes, StandardCharsets.UTF_8));
    }

    private static void saveDecimal(DataBase db, TableEnum table, byte[] key, BigDecimal value) {
        db.insert(table, key, DecimalUtil.normalize(value).toPlainString().getBytes(StandardCharsets.UTF_8));
    }
}
