package com.crossfire.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity a background job acts on behalf of.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackgroundJobParams {
    /** User principal name; scopes cached results to the user. */
    private String userPrincipalName;
    /** User object identifier; addresses delivery to the user's connections. */
    private String userSubscriberName;
}
