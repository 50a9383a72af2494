package org.tricoteuses.amendment.grammar;

import org.tricoteuses.amendment.tree.ActionKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Amendment verbs recognized after "est"/"sont", in every gender and number agreement.
 */
public enum AmendmentVerb {
    REPLACED("remplacé", ActionKind.REPLACE, true, false, false),
    REWRITTEN("ainsi rédigé", ActionKind.REPLACE, false, true, false),
    INSERTED("inséré", ActionKind.CREATE, false, false, false),
    ADDED("ajouté", ActionKind.CREATE, false, false, false),
    COMPLETED("complété", ActionKind.CREATE, false, false, true),
    REPEALED("abrogé", ActionKind.DELETE, false, false, false),
    REMOVED("supprimé", ActionKind.DELETE, false, false, false),
    RESTORED_AS("ainsi rétabli", ActionKind.CREATE_OR_REPLACE, false, true, false),
    RESTORED("rétabli", ActionKind.CREATE_OR_REPLACE, false, false, false);

    private static final Map<String, AmendmentVerb> FORMS = new LinkedHashMap<>();

    static {
        for (var verb : values()) {
            for (var ending : List.of("", "e", "s", "es")) {
                FORMS.put(verb.participle + ending, verb);
            }
        }
    }

    private final String participle;
    private final ActionKind kind;
    private final boolean requiresPar;
    private final boolean rewritesWholeTarget;
    private final boolean appends;

    AmendmentVerb(String participle, ActionKind kind, boolean requiresPar, boolean rewritesWholeTarget, boolean appends) {
        this.participle = participle;
        this.kind = kind;
        this.requiresPar = requiresPar;
        this.rewritesWholeTarget = rewritesWholeTarget;
        this.appends = appends;
    }

    public ActionKind kind() {
        return kind;
    }

    /**
     * "remplacé" only counts as an amendment when followed by "par".
     */
    public boolean requiresPar() {
        return requiresPar;
    }

    public boolean rewritesWholeTarget() {
        return rewritesWholeTarget;
    }

    /**
     * "est complété par": content goes at the end of the target.
     */
    public boolean appends() {
        return appends;
    }

    static List<String> forms() {
        return new ArrayList<>(FORMS.keySet());
    }

    static Optional<AmendmentVerb> fromForm(String form) {
        var key = Ordinals.fold(form);
        return FORMS.entrySet()
                    .stream()
                    .filter(entry -> Ordinals.fold(entry.getKey()).equals(key))
                    .map(Map.Entry::getValue)
                    .findFirst();
    }
}
