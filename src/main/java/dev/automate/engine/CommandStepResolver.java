package dev.automate.engine;

import dev.automate.backend.ApiCallDetector;
import dev.automate.model.CatalogEntry;
import dev.automate.model.CommandInvocation;
import dev.automate.model.CommandKind;
import dev.automate.model.CommandParam;
import dev.automate.model.ParameterBinding;
import dev.automate.model.ResolvedCommand;
import dev.automate.model.Step;
import dev.automate.model.StepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the command of a Write, Query or SetAndQuery step: catalog lookup, parameter
 * canonicalization, then template resolution in the shapes the step kind needs.
 */
public final class CommandStepResolver {

    private static final Logger log = LoggerFactory.getLogger(CommandStepResolver.class);

    private final CommandCatalog catalog;

    public CommandStepResolver(CommandCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Resolved command of {@code step}, or null for kinds that carry none.
     *
     * @throws CompileException if the step's template is malformed or missing
     */
    public ResolvedCommand resolve(Step step) {
        CommandInvocation invocation = ProgramValidator.invocationOf(step.action());
        if (invocation == null) {
            return null;
        }

        Optional<CatalogEntry> entry = catalog.find(invocation.catalogKey());
        if (invocation.catalogKey() != null && entry.isEmpty()) {
            log.debug("Step '{}': catalog has no command '{}'", step.id(), invocation.catalogKey());
        }
        String template = !invocation.command().isBlank()
            ? invocation.command()
            : entry.map(CatalogEntry::template).orElse("");
        if (template.isBlank()) {
            throw new CompileException(step.id(), "no command text", null);
        }
        List<CommandParam> declared = !invocation.params().isEmpty()
            ? invocation.params()
            : entry.map(CatalogEntry::params).orElse(List.of());
        entry.ifPresent(e -> checkKind(step, e));

        if (ApiCallDetector.isApiCall(template)) {
            return verbatim(step.action(), template.strip());
        }

        var canonical = ParameterCanonicalizer.canonicalizeWithReplacements(declared, template);
        List<CommandParam> params = canonical.params();
        ParameterBinding bindings = canonical.rebind(invocation.bindings());
        try {
            if (step.action() instanceof StepAction.Write) {
                return ResolvedCommand.write(TemplateResolver.resolveWrite(template, params, bindings));
            } else if (step.action() instanceof StepAction.Query) {
                return ResolvedCommand.query(TemplateResolver.resolveQuery(template, params, bindings));
            }
            return new ResolvedCommand(
                TemplateResolver.resolveWrite(template, params, bindings),
                TemplateResolver.resolveQuery(template, params, bindings));
        } catch (TemplateSyntaxException e) {
            throw new CompileException(step.id(), e.getMessage(), e);
        }
    }

    private static ResolvedCommand verbatim(StepAction action, String expression) {
        if (action instanceof StepAction.Write) {
            return ResolvedCommand.write(expression);
        } else if (action instanceof StepAction.Query) {
            return ResolvedCommand.query(expression);
        }
        return new ResolvedCommand(expression, expression);
    }

    private static void checkKind(Step step, CatalogEntry entry) {
        boolean writes = !(step.action() instanceof StepAction.Query);
        boolean queries = !(step.action() instanceof StepAction.Write);
        if ((writes && entry.kind() == CommandKind.QUERY_ONLY) || (queries && entry.kind() == CommandKind.SET_ONLY)) {
            log.warn("Step '{}' uses {} command '{}' as {}", step.id(), entry.kind(), entry.name(), step.kind());
        }
    }
}
