package tech.identitycore.server.registry;

public enum ScopeKind {
    IDENTITY,
    API
}
