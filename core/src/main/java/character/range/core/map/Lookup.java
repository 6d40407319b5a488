/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.map;

import lombok.NonNull;
import lombok.Value;

import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * The pair of caller-supplied functions a lazy {@link IndexMap} resolves symbols and indices with. Two lookups are
 * equal only if they hold the very same function objects.
 */
@Value
class Lookup<S> {
    @NonNull Function<? super S, Integer> symbolToIndex;
    @NonNull IntFunction<? extends S> indexToSymbol;
}
