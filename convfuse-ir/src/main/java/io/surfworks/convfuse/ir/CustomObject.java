package io.surfworks.convfuse.ir;

/**
 * A backend-defined object that can flow through the graph as a value.
 *
 * <p>Objects produced while a graph executes are strongly owned by whatever
 * produced them. Before such an object can be embedded in a graph as a
 * constant it has to be converted with {@link #toWeakReference()}, which
 * returns a form that shares the payload but holds no reference back to the
 * producing compilation context.
 */
public interface CustomObject {

    /**
     * Returns the class name, without {@link Types#CLASS_PREFIX}.
     */
    String className();

    /**
     * Returns a non-owning form of this object suitable for a graph constant.
     */
    CustomObject toWeakReference();

    /**
     * Returns true if this object is already in its non-owning form.
     */
    boolean isWeakReference();

    default Types.ClassType type() {
        return Types.classType(className());
    }
}
