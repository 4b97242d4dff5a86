package org.neuralchilli.tickflow.kernel;

import org.neuralchilli.tickflow.catalog.Resolution;
import org.neuralchilli.tickflow.catalog.VerbParameters;
import org.neuralchilli.tickflow.core.ExpressionEvaluator;
import org.neuralchilli.tickflow.core.ReachabilityService;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.Snapshot;

/**
 * The five verbs behind one entry point. Every call is a pure function of
 * snapshot, subject and parameters.
 */
public class Kernel {

    private final TransmuteVerb transmute;
    private final CopyVerb copy;
    private final FilterVerb filter;
    private final AwaitVerb await;
    private final VoidVerb voidVerb;

    public Kernel(MultiInstanceManager instances, ExpressionEvaluator evaluator, ReachabilityService reachability) {
        this.transmute = new TransmuteVerb();
        this.copy = new CopyVerb(instances, evaluator);
        this.filter = new FilterVerb(evaluator);
        this.await = new AwaitVerb(instances, reachability);
        this.voidVerb = new VoidVerb(instances);
    }

    public Delta execute(Snapshot snapshot, Resolution resolution) {
        VerbParameters params = resolution.parameters();
        return switch (resolution.verb()) {
            case TRANSMUTE -> transmute.apply(snapshot, resolution.subject());
            case COPY -> copy.apply(snapshot, resolution.subject(),
                    ((VerbParameters.CopyParameters) params).cardinality());
            case FILTER -> filter.apply(snapshot, resolution.subject(),
                    ((VerbParameters.FilterParameters) params).selectionMode());
            case AWAIT -> await.apply(snapshot, resolution.subject(),
                    (VerbParameters.AwaitParameters) params);
            case VOID -> voidVerb.apply(snapshot, resolution.subject(),
                    ((VerbParameters.VoidParameters) params).scope());
        };
    }
}
