package com.solrange.analyzer.types;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed lookup table of built-in functions and globals with their return types.
 * Types are elementary names understood by {@link Builtin#tryFrom(String)} (or
 * "bytes"/"string" for dynamic results).
 */
public final class BuiltinCatalog {

    private BuiltinCatalog() {}

    private static final Map<String, List<String>> FUNCTIONS = Map.ofEntries(
            Map.entry("require", List.of()),
            Map.entry("assert", List.of()),
            Map.entry("revert", List.of()),
            Map.entry("keccak256", List.of("bytes32")),
            Map.entry("sha256", List.of("bytes32")),
            Map.entry("ripemd160", List.of("bytes20")),
            Map.entry("ecrecover", List.of("address")),
            Map.entry("addmod", List.of("uint256")),
            Map.entry("mulmod", List.of("uint256")),
            Map.entry("gasleft", List.of("uint256")),
            Map.entry("blockhash", List.of("bytes32")),
            Map.entry("selfdestruct", List.of())
    );

    private static final Map<String, String> GLOBALS = Map.ofEntries(
            Map.entry("msg.sender", "address"),
            Map.entry("msg.value", "uint256"),
            Map.entry("msg.sig", "bytes4"),
            Map.entry("msg.data", "bytes"),
            Map.entry("tx.origin", "address"),
            Map.entry("tx.gasprice", "uint256"),
            Map.entry("block.timestamp", "uint256"),
            Map.entry("block.number", "uint256"),
            Map.entry("block.chainid", "uint256"),
            Map.entry("block.coinbase", "address"),
            Map.entry("block.basefee", "uint256"),
            Map.entry("block.gaslimit", "uint256"),
            Map.entry("block.prevrandao", "uint256"),
            Map.entry("block.difficulty", "uint256"),
            Map.entry("now", "uint256")
    );

    public static boolean isFunction(String name) {
        return FUNCTIONS.containsKey(name);
    }

    public static List<String> returnTypes(String function) {
        return FUNCTIONS.getOrDefault(function, List.of());
    }

    /** Type of a global such as {@code msg.sender} or {@code block.timestamp}. */
    public static Optional<String> globalType(String qualifiedName) {
        return Optional.ofNullable(GLOBALS.get(qualifiedName));
    }
}
