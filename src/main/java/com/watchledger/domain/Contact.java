package com.watchledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A counterparty in the CRM: lead, customer, trader or jeweler.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Contact {

    @EqualsAndHashCode.Include
    private String id;
    private String firstName;
    private String lastName;
    private String businessName;
    private ContactType contactType;

    /**
     * "First Last", falling back to the business name, then the id.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            sb.append(firstName.strip());
        }
        if (lastName != null && !lastName.isBlank()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(lastName.strip());
        }
        if (sb.length() > 0) {
            return sb.toString();
        }
        if (businessName != null && !businessName.isBlank()) {
            return businessName.strip();
        }
        return id;
    }
}
