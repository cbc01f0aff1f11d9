package no.cantara.tml.graph;

import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Composes an {@link OrganizationalGraph} from one or more Declarations: decision flows first,
 * then the dependencies they imply, then automation readiness per Capability.
 *
 * <p>Inputs are read, never modified. Running it twice on the same Declarations yields equal graphs.
 */
public class GraphComputer {

    private static final Logger log = LoggerFactory.getLogger(GraphComputer.class);

    private final DecisionFlowTracer tracer;
    private final DependencyDeriver deriver;
    private final AutomationScorer scorer;

    public GraphComputer() {
        this(GraphPolicy.defaults());
    }

    public GraphComputer(GraphPolicy policy) {
        this.tracer = new DecisionFlowTracer(policy);
        this.deriver = new DependencyDeriver(policy);
        this.scorer = new AutomationScorer();
    }

    public OrganizationalGraph compute(List<Declaration> declarations) {
        return compute(declarations, null);
    }

    /**
     * @param rootScope the Scope to anchor the graph at; {@code null} uses the first Declaration's Scope
     * @throws IllegalArgumentException if {@code declarations} is empty
     */
    public OrganizationalGraph compute(List<Declaration> declarations, Scope rootScope) {
        if (declarations == null || declarations.isEmpty()) {
            throw new IllegalArgumentException("At least one Declaration is required");
        }
        Scope root = rootScope != null ? rootScope : declarations.get(0).getScope();

        List<DecisionFlow> flows = tracer.trace(declarations);
        List<Dependency> dependencies = deriver.derive(flows);
        List<AutomationCandidate> candidates = scorer.score(declarations);

        log.info("Computed graph for {} declaration(s): {} flows, {} dependencies, {} automation candidates",
                declarations.size(), flows.size(), dependencies.size(), candidates.size());
        return new OrganizationalGraph(root, declarations, flows, dependencies, candidates);
    }
}
