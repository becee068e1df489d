package com.gnovoa.tournament.config;

import com.gnovoa.tournament.awards.AwardsResolver;
import com.gnovoa.tournament.schedule.*;
import com.gnovoa.tournament.sim.RandomSource;
import com.gnovoa.tournament.sim.RoundSimulator;
import com.gnovoa.tournament.sim.SplittableRandomSource;
import com.gnovoa.tournament.standings.StandingsCalculator;
import com.gnovoa.tournament.stats.StatsAggregator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** The format engine is plain Java; this exposes its pieces as beans. */
@Configuration
public class EngineWiring {

    @Bean
    public RoundRobinScheduler roundRobinScheduler() {
        return new RoundRobinScheduler();
    }

    @Bean
    public KnockoutBracketBuilder knockoutBracketBuilder() {
        return new KnockoutBracketBuilder();
    }

    @Bean
    public StandingsCalculator standingsCalculator() {
        return new StandingsCalculator();
    }

    @Bean
    public GroupStageComposer groupStageComposer(RoundRobinScheduler scheduler, StandingsCalculator standings, TournamentProperties props) {
        TournamentProperties.Groups g = props.groups();
        return new GroupStageComposer(scheduler, standings, g.smallFieldGroups(), g.largeFieldGroups(), g.largeFieldThreshold());
    }

    @Bean
    public FixtureValidator fixtureValidator() {
        return new FixtureValidator();
    }

    @Bean
    public FixtureGenerator fixtureGenerator(RoundRobinScheduler scheduler, KnockoutBracketBuilder bracket,
                                             GroupStageComposer groups, FixtureValidator validator) {
        return new FixtureGenerator(scheduler, bracket, groups, validator);
    }

    @Bean
    public StatsAggregator statsAggregator() {
        return new StatsAggregator();
    }

    @Bean
    public AwardsResolver awardsResolver(StandingsCalculator standings, StatsAggregator stats, KnockoutBracketBuilder bracket) {
        return new AwardsResolver(standings, stats, bracket);
    }

    @Bean
    public RandomSource randomSource(SimProperties props) {
        return props.seed() == null ? SplittableRandomSource.unseeded() : new SplittableRandomSource(props.seed());
    }

    @Bean
    public RoundSimulator roundSimulator(RandomSource randomSource, SimProperties props) {
        return new RoundSimulator(randomSource, props);
    }
}
