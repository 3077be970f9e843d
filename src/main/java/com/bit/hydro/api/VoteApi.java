package com.bit.hydro.api;

import com.bit.hydro.ledger.HydroLedger;
import com.bit.hydro.result.Result;
import com.bit.hydro.service.VoteService;
import com.bit.hydro.structure.dto.UnvoteRequest;
import com.bit.hydro.structure.dto.VoteRequest;
import com.bit.hydro.structure.env.BlockEnv;
import com.bit.hydro.structure.vote.Vote;
import com.bit.hydro.structure.vote.VoteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/vote")
public class VoteApi {

    @Autowired
    private HydroLedger hydroLedger;

    @Autowired
    private VoteService voteService;

    @PostMapping("/vote")
    public Result<VoteResult> vote(@RequestBody VoteRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> voteService.vote(context, request.getTrancheId(), request.getProposals())));
    }

    @PostMapping("/unvote")
    public Result<List<Long>> unvote(@RequestBody UnvoteRequest request) {
        return Result.OK(hydroLedger.execute(request.toEnv(),
                context -> voteService.unvote(context, request.getTrancheId(), request.getLockIds())));
    }

    // 用户锁仓在某轮某 tranche 的投票
    @GetMapping("/userVotes")
    public Result<Map<Long, Vote>> userVotes(@RequestParam String address, @RequestParam long roundId,
                                             @RequestParam long trancheId, @RequestParam long height,
                                             @RequestParam long timeNanos) {
        return Result.OK(hydroLedger.query(new BlockEnv(height, timeNanos, null),
                context -> voteService.userVotes(context, roundId, trancheId, address)));
    }
}
