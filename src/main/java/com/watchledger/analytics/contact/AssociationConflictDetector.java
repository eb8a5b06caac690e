package com.watchledger.analytics.contact;

import com.watchledger.domain.AssociationRole;
import com.watchledger.domain.WatchAssociation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds watches where more than one contact holds the same role. Nothing is rejected; the result is for the
 * caller to warn about.
 */
@Component
public class AssociationConflictDetector {

    public List<RoleConflict> findConflicts(List<WatchAssociation> associations) {
        if (associations == null || associations.isEmpty()) {
            return List.of();
        }
        Map<RoleKey, Set<String>> holders = new LinkedHashMap<>();
        for (WatchAssociation a : associations) {
            if (a == null || a.watchId() == null || a.role() == null || a.contactId() == null) {
                continue;
            }
            holders.computeIfAbsent(new RoleKey(a.watchId(), a.role()), k -> new LinkedHashSet<>())
                    .add(a.contactId());
        }
        List<RoleConflict> out = new ArrayList<>();
        holders.forEach((key, contacts) -> {
            if (contacts.size() > 1) {
                out.add(new RoleConflict(key.watchId(), key.role(), new ArrayList<>(contacts)));
            }
        });
        return List.copyOf(out);
    }

    private record RoleKey(String watchId, AssociationRole role) {}
}
