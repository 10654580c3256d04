package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

// Maps arbitrary tokens (words, chars, ...) to the dense integer symbols the trie works with.
public class AlphabetMapper<T> {

    public static final int UNKNOWN = -1;

    float loadFactor = 0.75f;

    // Primitive map to avoid boxing of the symbol values
    private final Object2IntOpenHashMap<T> tokenToId;
    private final ArrayList<T> idToToken;

    public AlphabetMapper(int capacity) {
        int expected = Math.max(1, capacity);
        // Pre-size to the expected alphabet size to avoid rehashing.
        this.tokenToId = new Object2IntOpenHashMap<>(expected, loadFactor);
        // -1 distinguishes a miss from the valid ids 0, 1, 2, ...
        this.tokenToId.defaultReturnValue(UNKNOWN);
        this.idToToken = new ArrayList<>(expected);
    }

    public int getSize() {
        return idToToken.size();
    }

    // Insert-on-miss mapping
    public int getId(T token) {
        int id = tokenToId.getInt(token);
        if (id == UNKNOWN) {
            id = idToToken.size();
            tokenToId.put(token, id);
            idToToken.add(token);
        }
        return id;
    }

    // Lookup only, UNKNOWN for tokens never seen.
    public int lookup(T token) {
        return tokenToId.getInt(token);
    }

    public T token(int id) {
        if (id < 0 || id >= idToToken.size()) {
            throw new IndexOutOfBoundsException("no token with id " + id);
        }
        return idToToken.get(id);
    }

    public int[] getIds(List<T> tokens) {
        int[] ids = new int[tokens.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = getId(tokens.get(i));
        }
        return ids;
    }

    public int[] lookupAll(List<T> tokens) {
        int[] ids = new int[tokens.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = lookup(tokens.get(i));
        }
        return ids;
    }

    public List<T> tokens(int[] ids) {
        List<T> out = new ArrayList<>(ids.length);
        for (int id : ids) {
            out.add(token(id));
        }
        return out;
    }

    public void clear() {
        tokenToId.clear();
        idToToken.clear();
    }
}
