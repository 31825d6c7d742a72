package io.hearthwarrio.stableid.core;

import java.util.Objects;

/**
 * Decides per node whether an automatic identifier is attached, and how it is named.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>explicit literal identifier on the node (never routed through the generator)</li>
 *   <li>node-local disable</li>
 *   <li>node-local enable, optionally carrying an exact name or a name</li>
 *   <li>ambient override inherited from ancestors</li>
 *   <li>global configuration ({@code enableAutoIds} and a mode that allows global generation)</li>
 * </ol>
 * This class is the policy; {@link IdentifierGenerator} is the mechanism.
 */
public final class AssignmentResolver {

    private final ConfigStore configStore;
    private final IdentifierGenerator generator;

    public AssignmentResolver(ConfigStore configStore, IdentifierGenerator generator) {
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Resolves a node with no ambient override.
     */
    public Assignment resolve(NodeDeclaration declaration) {
        return resolve(declaration, AmbientContext.root());
    }

    public Assignment resolve(NodeDeclaration declaration, AmbientContext ambient) {
        Objects.requireNonNull(declaration, "declaration must not be null");
        Objects.requireNonNull(ambient, "ambient must not be null");

        if (declaration.hasExplicitIdentifier()) {
            return Assignment.assigned(declaration.getExplicitIdentifier(), AssignmentSource.EXPLICIT_LITERAL);
        }
        if (declaration.isAutoIdsDisabled()) {
            return Assignment.none(AssignmentSource.LOCAL_DISABLE);
        }
        if (declaration.isAutoIdsEnabled()) {
            return resolveLocalEnable(declaration);
        }

        switch (ambient.effectiveOverride()) {
            case FORCE_ON:
                return Assignment.assigned(generate(declaration), AssignmentSource.AMBIENT_FORCE_ON);
            case FORCE_OFF:
                return Assignment.none(AssignmentSource.AMBIENT_FORCE_OFF);
            case INHERIT:
            default:
                break;
        }

        if (configStore.get().isGlobalGenerationEnabled()) {
            return Assignment.assigned(generate(declaration), AssignmentSource.GLOBAL_ENABLED);
        }
        return Assignment.none(AssignmentSource.GLOBAL_DISABLED);
    }

    /**
     * Resolves and attaches the result to {@code node}.
     * <p>
     * When nothing is assigned the node's identifier is left untouched.
     */
    public Assignment apply(IdentifiableNode node, NodeDeclaration declaration, AmbientContext ambient) {
        Objects.requireNonNull(node, "node must not be null");
        Assignment assignment = resolve(declaration, ambient);
        assignment.getIdentifier().ifPresent(node::setIdentifier);
        return assignment;
    }

    private Assignment resolveLocalEnable(NodeDeclaration declaration) {
        if (!declaration.getExactName().isEmpty()) {
            return Assignment.assigned(
                    generator.generateExactId(declaration.getExactName()),
                    AssignmentSource.LOCAL_EXACT_NAME
            );
        }
        if (!declaration.getName().isEmpty()) {
            return Assignment.assigned(
                    generator.generateId(declaration.getName(), declaration.getRole(), declaration.getContext()),
                    AssignmentSource.LOCAL_NAME
            );
        }
        return Assignment.assigned(generate(declaration), AssignmentSource.LOCAL_ENABLE);
    }

    private String generate(NodeDeclaration declaration) {
        return generator.generateId(
                declaration.getSubjectIdentity(),
                declaration.getRole(),
                declaration.getContext()
        );
    }
}
