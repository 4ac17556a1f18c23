package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;
import java.util.Objects;

/**
 * Dense symbol ids for arbitrary tokens, assigned in first-appearance order starting at 0.
 * Negative ids are never handed out: -1 means "unknown token" and is also the default
 * suffix tree terminator, so a foreign token can never match anything.
 */
public class AlphabetMapper<T> {

    public static final int UNKNOWN = -1;

    float loadFactor = 0.75f;

    // Primitive map to avoid boxing the ids
    private final Object2IntOpenHashMap<T> tokenToId;
    private final ObjectArrayList<T> idToToken;

    public AlphabetMapper(int capacity) {
        int expected = Math.max(1, capacity);
        // Pre-size to the expected alphabet size to avoid rehashing.
        this.tokenToId = new Object2IntOpenHashMap<>(expected, loadFactor);
        this.tokenToId.defaultReturnValue(UNKNOWN);
        this.idToToken = new ObjectArrayList<>(expected);
    }

    public int getSize() {
        return idToToken.size();
    }

    // Insert-on-miss mapping
    public int getId(T token) {
        Objects.requireNonNull(token, "token");
        int id = tokenToId.getInt(token);
        if (id == UNKNOWN) {
            id = idToToken.size();
            tokenToId.put(token, id);
            idToToken.add(token);
        }
        return id;
    }

    /** Id of a token already seen, or {@link #UNKNOWN}. Never inserts. */
    public int lookup(T token) {
        return token == null ? UNKNOWN : tokenToId.getInt(token);
    }

    public T tokenOf(int id) {
        return idToToken.get(id);
    }

    public int[] encode(List<? extends T> tokens) {
        int[] ids = new int[tokens.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = getId(tokens.get(i));
        }
        return ids;
    }

    /** Ids for a query; tokens never seen map to {@link #UNKNOWN}. */
    public int[] lookupAll(List<? extends T> tokens) {
        int[] ids = new int[tokens.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = lookup(tokens.get(i));
        }
        return ids;
    }

    public void clear() {
        tokenToId.clear();
        idToToken.clear();
    }
}
