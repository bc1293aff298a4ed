package com.phonepe.honeypotai.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Actionable artifacts pulled out of a conversation. Every category is a sorted set, so merging never duplicates.
 */
@Value
public class ExtractedIntelligence {
    private static final ExtractedIntelligence EMPTY = ExtractedIntelligence.builder().build();

    SortedSet<String> bankAccounts;
    SortedSet<String> upiIds;
    SortedSet<String> phishingLinks;
    SortedSet<String> phoneNumbers;
    SortedSet<String> suspiciousKeywords;

    @Builder
    @JsonCreator
    public ExtractedIntelligence(
            @JsonProperty("bankAccounts") Collection<String> bankAccounts,
            @JsonProperty("upiIds") Collection<String> upiIds,
            @JsonProperty("phishingLinks") Collection<String> phishingLinks,
            @JsonProperty("phoneNumbers") Collection<String> phoneNumbers,
            @JsonProperty("suspiciousKeywords") Collection<String> suspiciousKeywords) {
        this.bankAccounts = copy(bankAccounts);
        this.upiIds = copy(upiIds);
        this.phishingLinks = copy(phishingLinks);
        this.phoneNumbers = copy(phoneNumbers);
        this.suspiciousKeywords = copy(suspiciousKeywords);
    }

    public static ExtractedIntelligence empty() {
        return EMPTY;
    }

    /**
     * Union of this and the other value, category by category
     */
    public ExtractedIntelligence merge(final ExtractedIntelligence other) {
        if (null == other || other.isEmpty()) {
            return this;
        }
        return new ExtractedIntelligence(
                Sets.union(bankAccounts, other.bankAccounts),
                Sets.union(upiIds, other.upiIds),
                Sets.union(phishingLinks, other.phishingLinks),
                Sets.union(phoneNumbers, other.phoneNumbers),
                Sets.union(suspiciousKeywords, other.suspiciousKeywords));
    }

    /**
     * Entries present here but not in the other value
     */
    public ExtractedIntelligence minus(final ExtractedIntelligence other) {
        if (null == other || other.isEmpty()) {
            return this;
        }
        return new ExtractedIntelligence(
                Sets.difference(bankAccounts, other.bankAccounts),
                Sets.difference(upiIds, other.upiIds),
                Sets.difference(phishingLinks, other.phishingLinks),
                Sets.difference(phoneNumbers, other.phoneNumbers),
                Sets.difference(suspiciousKeywords, other.suspiciousKeywords));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return bankAccounts.isEmpty()
                && upiIds.isEmpty()
                && phishingLinks.isEmpty()
                && phoneNumbers.isEmpty()
                && suspiciousKeywords.isEmpty();
    }

    @JsonIgnore
    public boolean hasAny() {
        return !isEmpty();
    }

    private static SortedSet<String> copy(Collection<String> values) {
        return ImmutableSortedSet.copyOf(Objects.requireNonNullElse(values, Set.<String>of()));
    }
}
