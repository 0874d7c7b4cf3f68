/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bidirectional mapping between payload classes and the stable names they are stored under.
 *
 * <p>Contracts outlive class names: renaming or moving an event class only requires registering it
 * under its old contract.
 */
public final class TypeToContractMap {
  /** Separates the namespace from the type name in generated contracts. */
  public static final String DELIMITER = "/";

  private final Map<Class<?>, String> contractsByType;
  private final Map<String, Class<?>> typesByContract;

  private TypeToContractMap(
      final Map<Class<?>, String> contractsByType, final Map<String, Class<?>> typesByContract) {
    this.contractsByType = Map.copyOf(contractsByType);
    this.typesByContract = Map.copyOf(typesByContract);
  }

  /**
   * @return builder generating contracts from simple class names
   */
  public static Builder builder() {
    return new Builder(null);
  }

  /**
   * @param namespace prepended to generated contracts
   * @return builder generating contracts as {@code namespace/SimpleName}
   */
  public static Builder builder(final String namespace) {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("Contract namespace cannot be blank");
    }

    return new Builder(namespace);
  }

  /**
   * @param type to look up
   * @return contract of the type
   * @throws IllegalArgumentException if the type was not registered
   */
  public String contractOf(final Class<?> type) {
    final String contract = contractsByType.get(type);
    if (contract == null) {
      throw new IllegalArgumentException(
          "No contract registered for %s".formatted(type == null ? null : type.getName()));
    }

    return contract;
  }

  /**
   * @param contract to look up
   * @return type registered under the contract
   * @throws IllegalArgumentException if the contract is unknown
   */
  public Class<?> typeOf(final String contract) {
    final Class<?> type = typesByContract.get(contract);
    if (type == null) {
      throw new IllegalArgumentException("No type registered for contract %s".formatted(contract));
    }

    return type;
  }

  public Set<Class<?>> getRegisteredTypes() {
    return contractsByType.keySet();
  }

  /** Collects registrations, rejecting ambiguous ones. */
  public static final class Builder {
    private final String namespace;
    private final Map<Class<?>, String> contractsByType;
    private final Map<String, Class<?>> typesByContract;

    private Builder(final String namespace) {
      this.namespace = namespace;
      this.contractsByType = new HashMap<>();
      this.typesByContract = new HashMap<>();
    }

    /**
     * @param type to register under a generated contract
     * @return current builder
     */
    public Builder register(final Class<?> type) {
      if (type == null) {
        throw new IllegalArgumentException("Registered type cannot be null");
      }

      final String name = type.getSimpleName();
      return register(type, namespace == null ? name : namespace + DELIMITER + name);
    }

    /**
     * @param type to register
     * @param contract to register the type under
     * @return current builder
     * @throws IllegalStateException if the type or the contract is already taken
     */
    public Builder register(final Class<?> type, final String contract) {
      if (type == null) {
        throw new IllegalArgumentException("Registered type cannot be null");
      }

      if (contract == null || contract.isBlank()) {
        throw new IllegalArgumentException("Contract cannot be blank");
      }

      if (contractsByType.containsKey(type)) {
        throw new IllegalStateException(
            "%s is already registered as %s".formatted(type.getName(), contractsByType.get(type)));
      }

      if (typesByContract.containsKey(contract)) {
        throw new IllegalStateException(
            "Contract %s is already used by %s"
                .formatted(contract, typesByContract.get(contract).getName()));
      }

      contractsByType.put(type, contract);
      typesByContract.put(contract, type);
      return this;
    }

    public TypeToContractMap build() {
      return new TypeToContractMap(contractsByType, typesByContract);
    }
  }
}
