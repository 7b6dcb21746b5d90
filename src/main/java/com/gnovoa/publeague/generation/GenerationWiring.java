package com.gnovoa.publeague.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.publeague.lifecycle.InMemoryMatchCreator;
import com.gnovoa.publeague.lifecycle.InMemoryScheduleTemplateStore;
import com.gnovoa.publeague.lifecycle.MatchCreator;
import com.gnovoa.publeague.lifecycle.ScheduleTemplateStore;
import com.gnovoa.publeague.lifecycle.TemplateLifecycle;
import com.gnovoa.publeague.rosters.RosterCatalog;
import com.gnovoa.publeague.rosters.SchedulerProperties;
import com.gnovoa.publeague.rosters.TeamDirectory;
import com.gnovoa.publeague.schedule.ConstraintValidator;
import com.gnovoa.publeague.schedule.PairingGenerator;
import com.gnovoa.publeague.schedule.TimeSlotAndFieldAssigner;
import com.gnovoa.publeague.season.WeekPlanBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GenerationWiring {

    @Bean
    public ConstraintValidator constraintValidator() {
        return new ConstraintValidator();
    }

    @Bean
    public PairingGenerator pairingGenerator(ConstraintValidator validator, SchedulerProperties props) {
        return new PairingGenerator(validator, props.maxRetryAttempts());
    }

    @Bean
    public TimeSlotAndFieldAssigner timeSlotAndFieldAssigner(SchedulerProperties props) {
        return new TimeSlotAndFieldAssigner(props.fields(), props.startTime(), props.matchDurationMinutes());
    }

    @Bean
    public WeekPlanBuilder weekPlanBuilder(PairingGenerator generator, TimeSlotAndFieldAssigner assigner, ConstraintValidator validator) {
        return new WeekPlanBuilder(generator, assigner, validator);
    }

    @Bean
    @ConditionalOnMissingBean(TeamDirectory.class)
    public TeamDirectory teamDirectory(ObjectMapper mapper, SchedulerProperties props) {
        return new RosterCatalog(mapper, props);
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleTemplateStore.class)
    public ScheduleTemplateStore scheduleTemplateStore() {
        return new InMemoryScheduleTemplateStore();
    }

    @Bean
    @ConditionalOnMissingBean(MatchCreator.class)
    public MatchCreator matchCreator() {
        return new InMemoryMatchCreator();
    }

    @Bean
    public TemplateLifecycle templateLifecycle(ScheduleTemplateStore store, MatchCreator matchCreator) {
        return new TemplateLifecycle(store, matchCreator);
    }

    @Bean
    public SeasonGenerationService seasonGenerationService(TeamDirectory directory, WeekPlanBuilder planBuilder,
                                                           TemplateLifecycle lifecycle, ConstraintValidator validator) {
        return new SeasonGenerationService(directory, planBuilder, lifecycle, validator);
    }
}
