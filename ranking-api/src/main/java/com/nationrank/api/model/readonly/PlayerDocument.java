package com.nationrank.api.model.readonly;

import org.springframework.data.annotation.Id;

/**
 * Read-only model of a player profile.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "players")
public class PlayerDocument {

    @Id
    private String id;

    private String userId;
    private String name;
    private String countryCode;

    public PlayerDocument() {
    }

    public PlayerDocument(String userId, String name, String countryCode) {
        this.userId = userId;
        this.name = name;
        this.countryCode = countryCode;
    }

    public String getId() { return id; }
    public String getUserId() { return userId; }
    public String getName() { return name; }
    public String getCountryCode() { return countryCode; }
}
