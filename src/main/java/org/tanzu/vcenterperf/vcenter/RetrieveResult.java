package org.tanzu.vcenterperf.vcenter;

import java.util.List;

/**
 * One page of a property collector retrieval. A non-null token means more pages follow.
 */
public final class RetrieveResult {

    private final String token;
    private final List<ObjectContent> objects;

    public RetrieveResult(String token, List<ObjectContent> objects) {
        this.token = token;
        this.objects = List.copyOf(objects);
    }

    public String getToken() { return token; }

    public List<ObjectContent> getObjects() { return objects; }

    public boolean hasMore() { return token != null && !token.isEmpty(); }
}
