package com.bit.hydro.service;

import com.bit.hydro.LedgerTestSupport;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.proposal.Tranche;
import com.bit.hydro.util.DecimalUtil;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class GovernanceServiceTest extends LedgerTestSupport {

    @Test
    void instantiateSeedsAdminsTranchesAndConstants() {
        assertFalse(hydroLedger.initialize(hydroConfig));

        assertEquals(List.of(ADMIN), query(context -> governanceService.whitelistAdmins(context)));
        List<Tranche> tranches = query(context -> governanceService.tranches(context));
        assertEquals(1, tranches.size());
        assertEquals(TRANCHE_ID, tranches.get(0).getId());
        assertEquals("tranche 1", tranches.get(0).getName());

        Constants constants = query(context -> context.getConstants());
        assertEquals(ROUND_LENGTH, constants.getRoundLength());
        assertEquals(FIRST_ROUND_START, constants.getFirstRoundStart());
        assertEquals(RECEIVER, constants.getSlashTokensReceiverAddr());
        assertEquals(3, constants.getRoundLockPowerSchedule().getMaximumRoundsToLock());
        assertFalse(constants.isPaused());
    }

    @Test
    void constantsUpdateTakesEffectAtActivation() {
        Constants current = query(context -> context.getConstants());
        Constants updated = current.toBuilder().slashPercentageThreshold(DecimalUtil.of("0.6")).build();

        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER, context -> {
            governanceService.updateConstants(context, context.now(), updated);
            return null;
        }));
        HydroException past = assertHydroError(ErrorType.VALIDATION, () -> exec(ADMIN, context -> {
            governanceService.updateConstants(context, context.now() - 1, updated);
            return null;
        }));
        assertEquals("Can not update constants in the past.", past.getDetail());
        assertHydroError(ErrorType.VALIDATION, () -> exec(ADMIN, context -> {
            governanceService.updateConstants(context, context.now(),
                    current.toBuilder().roundLength(ROUND_LENGTH / 2).build());
            return null;
        }));

        exec(ADMIN, context -> {
            governanceService.updateConstants(context, FIRST_ROUND_START + ROUND_LENGTH, updated);
            return null;
        });
        assertEquals(0, DecimalUtil.of("0.5").compareTo(
                query(context -> context.getConstants()).getSlashPercentageThreshold()));

        atRound(1);
        assertEquals(0, DecimalUtil.of("0.6").compareTo(
                query(context -> context.getConstants()).getSlashPercentageThreshold()));
    }

    @Test
    void whitelistControlsProposalCreation() {
        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER, context ->
                governanceService.createProposal(context, TRANCHE_ID, "title", "description", 1)));

        exec(ADMIN, context -> {
            governanceService.addToWhitelist(context, USER);
            return null;
        });
        assertEquals(List.of(USER), query(context -> governanceService.whitelist(context)));
        HydroException duplicate = assertHydroError(ErrorType.VALIDATION, () -> exec(ADMIN, context -> {
            governanceService.addToWhitelist(context, USER);
            return null;
        }));
        assertEquals("Address already in whitelist", duplicate.getDetail());

        Proposal proposal = exec(USER, context ->
                governanceService.createProposal(context, TRANCHE_ID, "title", "description", 2));
        assertEquals(0, proposal.getRoundId());
        assertEquals(2, proposal.getDeploymentDuration());
        assertEquals(List.of(proposal), query(context -> governanceService.roundProposals(context, 0, TRANCHE_ID)));

        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context ->
                governanceService.createProposal(context, TRANCHE_ID, "title", "description", 0)));
        assertHydroError(ErrorType.NOT_FOUND, () -> exec(USER, context ->
                governanceService.createProposal(context, 9, "title", "description", 1)));

        exec(ADMIN, context -> {
            governanceService.removeFromWhitelist(context, USER);
            return null;
        });
        assertTrue(query(context -> governanceService.whitelist(context)).isEmpty());
    }

    @Test
    void tranchesHaveUniqueNames() {
        Tranche added = exec(ADMIN, context -> governanceService.addTranche(context, "tranche 2", "second"));
        assertEquals(2, added.getId());
        assertEquals(2, query(context -> governanceService.tranches(context)).size());

        assertHydroError(ErrorType.VALIDATION, () -> exec(ADMIN, context ->
                governanceService.addTranche(context, "tranche 1", "")));
        assertHydroError(ErrorType.VALIDATION, () -> exec(ADMIN, context ->
                governanceService.addTranche(context, " ", "")));
        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER, context ->
                governanceService.addTranche(context, "tranche 3", "")));
    }

    @Test
    void onlyAdminUpdatesTokenRatios() {
        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER, context -> {
            tokenRatioService.updateTokenGroupRatio(context, VALIDATOR_1, DecimalUtil.of("1"));
            return null;
        }));
        assertHydroError(ErrorType.VALIDATION, () -> setRatio("uatom", "2"));
        assertHydroError(ErrorType.VALIDATION, () -> setRatio("unknown-group", "1"));

        setRatio(VALIDATOR_1, "1.1");
        atRound(2);
        // 没有新记录的轮次沿用之前的比率
        assertEquals(0, DecimalUtil.of("1.1").compareTo(
                query(context -> tokenRatioService.tokenGroupRatio(context, 2, VALIDATOR_1))));
        assertEquals(0, DecimalUtil.of("1.1").compareTo(
                query(context -> tokenRatioService.allTokenGroupRatios(context, 2)).get(VALIDATOR_1)));
    }
}
