package com.watchledger.analytics.contact;

import com.watchledger.domain.ContactType;

/**
 * Relationship summary for one contact. {@code purchase}: watches the trader bought from the contact
 * (contact held SELLER). {@code sales}: watches the trader sold to the contact (contact held BUYER).
 */
public record ContactSummary(
        String contactId,
        String contactName,
        ContactType contactType,
        TradeSideMetrics purchase,
        TradeSideMetrics sales,
        RelationshipMetrics relationship
) {
}
