package in.sitewatch.application.alerting;

import in.sitewatch.domain.rule.ChannelType;

/**
 * Identity of a pending retry: one per alert, rule, ladder level and channel slot.
 *
 * {@code escalationLevel} is 0 for the initial send. {@code channelIndex} is the
 * channel's position in the rule's (or ladder step's) channel list, so two channels
 * of the same type keep separate retries.
 */
public record RetryKey(
    String alertId,
    String ruleId,
    int escalationLevel,
    int channelIndex,
    ChannelType channelType
) {}
