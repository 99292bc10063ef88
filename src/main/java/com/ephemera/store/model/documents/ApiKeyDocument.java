package com.ephemera.store.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Permission record for an API token. {@code "*"} in {@code allowedNamespaces} grants
 * every namespace.
 */
@Document("api_keys")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyDocument {

    private @Id String id;

    @Indexed(unique = true)
    private String key;

    @Builder.Default
    private List<String> allowedNamespaces = new ArrayList<>(List.of("*"));

    @Builder.Default
    private boolean active = true;
}
