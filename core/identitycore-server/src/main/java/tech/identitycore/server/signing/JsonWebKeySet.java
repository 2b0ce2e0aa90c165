package tech.identitycore.server.signing;

import java.util.List;

public record JsonWebKeySet(List<JsonWebKey> keys) {}
