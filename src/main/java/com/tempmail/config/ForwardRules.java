package com.tempmail.config;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Local-part forwarding table.
 * The longest matching prefix wins; the "*" entry matches every local part.
 * Targets inside one of the accepted mail domains are dropped so that a forward never loops back.
 */
public final class ForwardRules {

    public static final String CATCH_ALL = "*";

    public record Rule(String prefix, String target) {
    }

    private final List<Rule> rules;
    private final List<String> domains;

    public ForwardRules(List<Rule> rules, List<String> domains) {
        this.domains = List.copyOf(domains);
        List<Rule> usable = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.prefix() == null || rule.prefix().isBlank() || rule.target() == null || rule.target().isBlank()) {
                continue;
            }
            if (isLocalTarget(rule.target())) {
                continue;
            }
            usable.add(new Rule(rule.prefix().trim().toLowerCase(Locale.ROOT), rule.target().trim()));
        }
        usable.sort(Comparator
                .comparing((Rule r) -> CATCH_ALL.equals(r.prefix()))
                .thenComparing(r -> -r.prefix().length()));
        this.rules = List.copyOf(usable);
    }

    public static ForwardRules from(ServerProperties properties) {
        List<Rule> rules = properties.getForward().getRules().stream()
                .map(r -> new Rule(r.getPrefix(), r.getTarget()))
                .toList();
        return new ForwardRules(rules, properties.getDomainList());
    }

    public static ForwardRules none() {
        return new ForwardRules(List.of(), List.of());
    }

    /**
     * Forwarding target for a local part
     */
    public Optional<String> resolve(String localPart) {
        if (localPart == null || localPart.isBlank()) {
            return Optional.empty();
        }
        String lower = localPart.toLowerCase(Locale.ROOT);
        for (Rule rule : rules) {
            if (CATCH_ALL.equals(rule.prefix()) || lower.startsWith(rule.prefix())) {
                return Optional.of(rule.target());
            }
        }
        return Optional.empty();
    }

    public List<Rule> rules() {
        return rules;
    }

    private boolean isLocalTarget(String target) {
        int at = target.lastIndexOf('@');
        return at >= 0 && domains.contains(target.substring(at + 1).trim().toLowerCase(Locale.ROOT));
    }
}
