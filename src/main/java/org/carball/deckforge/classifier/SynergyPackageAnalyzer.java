package org.carball.deckforge.classifier;

import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.synergy.CardRoleMatch;
import org.carball.deckforge.model.synergy.PackageAnalysis;
import org.carball.deckforge.model.synergy.PackageBonus;
import org.carball.deckforge.model.synergy.PackageRole;
import org.carball.deckforge.model.synergy.SynergyPackage;
import org.carball.deckforge.ontology.PatternMatcher;
import org.carball.deckforge.ontology.SynergyPackageRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Detects which synergy packages a deck is building toward and which roles it still lacks.
 */
public class SynergyPackageAnalyzer {

    private static final double COMPLETING_BONUS = 0.3;
    private static final double REINFORCING_BONUS = 0.15;
    private static final double MAX_BONUS = 0.5;
    private static final int REINFORCE_BELOW = 3;
    private static final double RELEVANT_COMPLETENESS = 0.5;

    private final SynergyPackageRegistry registry;

    public SynergyPackageAnalyzer() {
        this(SynergyPackageRegistry.defaults());
    }

    public SynergyPackageAnalyzer(SynergyPackageRegistry registry) {
        this.registry = registry;
    }

    /**
     * Packages with at least one required role filled, in registry order.
     */
    public List<PackageAnalysis> analyzeDeckPackages(List<Card> cards) {
        List<PackageAnalysis> analyses = new ArrayList<>();
        for (SynergyPackage synergyPackage : registry.packages()) {
            PackageAnalysis analysis = analyzePackage(synergyPackage, cards);
            if (analysis.getCompleteness() > 0) {
                analyses.add(analysis);
            }
        }
        return analyses;
    }

    public PackageAnalysis analyzePackage(SynergyPackage synergyPackage, List<Card> cards) {
        PackageAnalysis analysis = new PackageAnalysis();
        analysis.setSynergyPackage(synergyPackage);

        for (Card card : cards) {
            for (PackageRole role : synergyPackage.getRoles()) {
                if (matchesRole(card, role)) {
                    analysis.getFilledRoles().merge(role.getName(), 1, Integer::sum);
                }
            }
        }

        int requiredFilled = 0;
        int totalRequired = 0;
        for (PackageRole role : synergyPackage.getRoles()) {
            if (!role.isRequired()) {
                continue;
            }
            totalRequired++;
            if (analysis.filledCount(role.getName()) > 0) {
                requiredFilled++;
            } else {
                analysis.getMissingRoles().add(role.getDisplayName());
            }
        }

        if (totalRequired > 0) {
            analysis.setCompleteness((double) requiredFilled / totalRequired);
        }
        long rolesWithCards = analysis.getFilledRoles().values().stream().filter(count -> count > 0).count();
        analysis.setActive(rolesWithCards >= synergyPackage.getMinRoles());
        return analysis;
    }

    /**
     * Every package role the card can fill.
     */
    public List<CardRoleMatch> cardRoles(Card card) {
        List<CardRoleMatch> roles = new ArrayList<>();
        for (SynergyPackage synergyPackage : registry.packages()) {
            for (PackageRole role : synergyPackage.getRoles()) {
                if (matchesRole(card, role)) {
                    roles.add(new CardRoleMatch(synergyPackage.getName(), role.getName(),
                            role.getDisplayName(), role.isRequired()));
                }
            }
        }
        return roles;
    }

    /**
     * Bonus for filling a missing required role (0.3) or reinforcing a thin role (0.15), summed over
     * every package that is active or at least half complete, capped at 0.5.
     */
    public PackageBonus scoreCardForPackages(Card card, List<PackageAnalysis> deckAnalyses) {
        double bonus = 0.0;
        List<String> reasons = new ArrayList<>();
        List<CardRoleMatch> roles = cardRoles(card);

        for (PackageAnalysis analysis : deckAnalyses) {
            if (!analysis.isActive() && analysis.getCompleteness() < RELEVANT_COMPLETENESS) {
                continue;
            }

            for (CardRoleMatch role : roles) {
                if (!role.packageName().equals(analysis.getPackageName())) {
                    continue;
                }

                int current = analysis.filledCount(role.roleName());
                if (current == 0 && role.required()) {
                    bonus += COMPLETING_BONUS;
                    reasons.add("Completes " + analysis.getPackageName() + " package (adds " + role.roleDisplay() + ")");
                } else if (current < REINFORCE_BELOW) {
                    bonus += REINFORCING_BONUS;
                    reasons.add("Strengthens " + analysis.getPackageName() + " (more " + role.roleDisplay() + ")");
                }
            }
        }

        return new PackageBonus(Math.min(bonus, MAX_BONUS), reasons);
    }

    /**
     * "Consider adding: A, B" for a package at least half complete, otherwise empty.
     */
    public String missingRoleSuggestion(PackageAnalysis analysis) {
        if (analysis.getMissingRoles().isEmpty() || analysis.getCompleteness() < RELEVANT_COMPLETENESS) {
            return "";
        }
        return "Consider adding: " + String.join(", ", analysis.getMissingRoles());
    }

    static boolean matchesRole(Card card, PackageRole role) {
        String oracleText = card.hasOracleText() ? card.getOracleText().toLowerCase(Locale.ROOT) : "";
        String typeLine = card.getTypeLine().toLowerCase(Locale.ROOT);

        if (PatternMatcher.containsAny(oracleText, role.getPatterns())) {
            return true;
        }

        for (String type : role.getTypeLines()) {
            if (typeLine.contains(type.toLowerCase(Locale.ROOT))
                    && (role.getMaxCmc() == null || card.getCmc() <= role.getMaxCmc())) {
                return true;
            }
        }

        for (String keyword : role.getKeywords()) {
            if (oracleText.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }

        return role.getMinCreatureCmc() != null
                && card.getCmc() >= role.getMinCreatureCmc()
                && typeLine.contains("creature");
    }
}
