package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.Token;

public record TokenFact(Token token) implements Fact {

    public TokenFact {
        if (token == null) {
            throw new IllegalArgumentException("Token fact needs a token");
        }
    }

    public static TokenFact on(NodeRef ref) {
        return new TokenFact(Token.on(ref));
    }

    public NodeRef ref() {
        return token.ref();
    }

    @Override
    public String key() {
        return "token:" + token.ref();
    }

    @Override
    public String nodeId() {
        return token.nodeId();
    }
}
