package io.swarmhive.client;

@FunctionalInterface
public interface CollaboratorRestarter {
    /**
     * @return true when the collaborator came back healthy
     */
    boolean restart();
}
