package org.walletsync.ledger;

import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Set;

/**
 * User set coin memos and locks, applied on top of each projection.
 */
public class CoinControl {
    private final Map<CoinId, String> memos = Maps.newHashMap();
    private final Set<CoinId> locked = Sets.newHashSet();

    public Optional<String> getMemo(CoinId id) {
        return Optional.fromNullable(memos.get(id));
    }

    /** An empty memo removes the override */
    public void setMemo(CoinId id, String memo) {
        if (Strings.isNullOrEmpty(memo))
            memos.remove(id);
        else
            memos.put(id, memo);
    }

    public boolean isLocked(CoinId id) {
        return locked.contains(id);
    }

    public boolean lock(CoinId id) {
        return locked.add(id);
    }

    public boolean unlock(CoinId id) {
        return locked.remove(id);
    }
}
