package com.gnovoa.tournament.api;

import com.gnovoa.tournament.api.dto.GoalRequest;
import com.gnovoa.tournament.api.dto.PenaltiesRequest;
import com.gnovoa.tournament.api.dto.ScheduleRequest;
import com.gnovoa.tournament.api.dto.ScoreRequest;
import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.MatchScorer;
import com.gnovoa.tournament.service.MatchResultService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/matches")
public class MatchController {

    private final MatchResultService results;

    public MatchController(MatchResultService results) {
        this.results = results;
    }

    @GetMapping("/{matchId}")
    public Match get(@PathVariable String matchId) {
        return results.getMatch(matchId);
    }

    @PostMapping("/{matchId}/start")
    public Match start(@PathVariable String matchId) {
        return results.start(matchId);
    }

    @PutMapping("/{matchId}/score")
    public Match score(@PathVariable String matchId, @Valid @RequestBody ScoreRequest req) {
        return results.updateScore(matchId, req.homeScore(), req.awayScore(), req.homePenalties(), req.awayPenalties());
    }

    @PostMapping("/{matchId}/penalties")
    public Match penalties(@PathVariable String matchId, @Valid @RequestBody PenaltiesRequest req) {
        return results.recordPenalties(matchId, req.homePenalties(), req.awayPenalties());
    }

    @PostMapping("/{matchId}/goals")
    @ResponseStatus(HttpStatus.CREATED)
    public MatchScorer goal(@PathVariable String matchId, @Valid @RequestBody GoalRequest req) {
        return results.recordGoal(matchId, req.playerId(), req.minute(), req.assistPlayerId());
    }

    @PostMapping("/{matchId}/finish")
    public Match finish(@PathVariable String matchId) {
        return results.finish(matchId);
    }

    @PutMapping("/{matchId}/schedule")
    public Match schedule(@PathVariable String matchId, @RequestBody ScheduleRequest req) {
        return results.schedule(matchId, req.pitch(), req.kickoffAt());
    }
}
