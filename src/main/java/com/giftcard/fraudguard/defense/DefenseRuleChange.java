package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.domain.DefenseRule;

/** A rule after {@link DefenseRuleService#enforce}; {@code created} is false when an existing rule was strengthened. */
public record DefenseRuleChange(DefenseRule rule, boolean created) {}
