package com.querysub.client.fake;

import com.querysub.common.api.ActiveQueryRegistry;
import com.querysub.common.api.BoundQuery;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

public class FakeActiveQueryRegistry implements ActiveQueryRegistry {
    private final Set<BoundQuery> active = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));

    @Override
    public void register(BoundQuery query) {
        active.add(query);
    }

    @Override
    public boolean remove(BoundQuery query) {
        return active.remove(query);
    }

    @Override
    public boolean contains(BoundQuery query) {
        return active.contains(query);
    }
}
