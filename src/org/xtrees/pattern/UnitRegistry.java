/* @LICENSE@
 */
package org.xtrees.pattern;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Units} which dispatches on the runtime class of the element. This
 * is how an adaptation layer teaches the engine about element types it does
 * not own (AST node classes, say) without touching those types.
 * <p>
 * Resolution for an element of class <code>C</code>: the {@link Units}
 * registered for <code>C</code> itself; otherwise the one registered for the
 * nearest ancestor of <code>C</code>, searching superclass and interfaces
 * breadth first; otherwise {@link Units#natural()}. Resolutions are cached
 * per class. An element is never equivalent to a value outside the class
 * its {@link Units} was registered for.
 * <p>
 * Not thread safe: resolutions are cached lazily, on first use of each
 * class, so even a fully registered instance belongs to one thread at a time.
 */
public final class UnitRegistry extends Units<Object> {

    private static final Logger logger = Logger.getLogger("org.xtrees.pattern");
    private static final Level level = Level.FINEST;

    /*
     * a registration: the Units only ever sees instances of type
     */
    private static final class Entry {
        final Class<?> type;
        final Units<Object> units;
        Entry(Class<?> type, Units<Object> units) {
            this.type = type;
            this.units = units;
        }
        @Override
        public String toString() {
            return type.getName() + "=" + units;
        }
    }

    private static final Entry NATURAL = new Entry(Object.class, natural());

    private final Map<Class<?>, Entry> registered = new LinkedHashMap<Class<?>, Entry>();
    private final Map<Class<?>, Entry> resolved = new HashMap<Class<?>, Entry>();

    @SuppressWarnings("unchecked")
    public <X> UnitRegistry register(Class<X> type, Units<? super X> units) {
        if (type == null || units == null) {
            throw new NullPointerException("type and units are required");
        }
        registered.put(type, new Entry(type, (Units<Object>) units));
        resolved.clear();
        return this;
    }

    public boolean isRegistered(Class<?> type) {
        return registered.containsKey(type);
    }

    /**
     * @return the {@link Units} used for elements of class <code>type</code>.
     */
    public Units<Object> resolve(Class<?> type) {
        return entry(type).units;
    }

    private Entry entry(Class<?> type) {
        Entry e = resolved.get(type);
        if (e == null) {
            e = lookup(type);
            resolved.put(type, e);
            if (logger.isLoggable(level)) {
                logger.log(level, "resolved " + type.getName() + " -> " + e);
            }
        }
        return e;
    }

    private Entry lookup(Class<?> type) {
        /*
         * breadth first over the supertype graph: the first tier holding a
         * registration wins, ties go to the superclass then interfaces in
         * declaration order.
         */
        List<Class<?>> tier = new LinkedList<Class<?>>();
        Set<Class<?>> seen = new HashSet<Class<?>>();
        tier.add(type);
        while (!tier.isEmpty()) {
            for (Class<?> c : tier) {
                Entry e = registered.get(c);
                if (e != null) return e;
            }
            List<Class<?>> next = new LinkedList<Class<?>>();
            for (Class<?> c : tier) {
                if (c.getSuperclass() != null && seen.add(c.getSuperclass())) {
                    next.add(c.getSuperclass());
                }
                for (Class<?> i : c.getInterfaces()) {
                    if (seen.add(i)) next.add(i);
                }
            }
            tier = next;
        }
        return NATURAL;
    }

    @Override
    public boolean equivalent(Object a, Object b) {
        if (a == null) return b == null;
        Entry e = entry(a.getClass());
        return e.type.isInstance(b) && e.units.equivalent(a, b);
    }

    @Override
    public String display(Object a) {
        if (a == null) return "null";
        return resolve(a.getClass()).display(a);
    }

    @Override
    public String toString() {
        return "UnitRegistry" + registered.keySet();
    }
}
