package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.domain.DefenseRule;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LearningResult {

    int rulesCreated;
    int rulesUpdated;
    /** Percent of replayed fraudulent events the rules in force already caught, one decimal. */
    double learningEffectiveness;
    /** Rules created or strengthened by this pass. */
    List<DefenseRule> rules;
}
