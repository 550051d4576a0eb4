package org.attrition.engine.api.resources;

/**
 * A component that wraps an external system, such as the game database, and is owned by the
 * engine.
 */
public interface IResource {

    /**
     * @return the name the resource was configured under
     */
    String getResourceName();
}
