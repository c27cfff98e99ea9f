package com.ordinalcomparator.reconcile.endpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ordinalcomparator.domain.Brc20Entry;
import com.ordinalcomparator.domain.Brc20Operation;
import com.ordinalcomparator.domain.Brc20Receipts;
import com.ordinalcomparator.domain.OrdinalEvent;
import com.ordinalcomparator.domain.OrdinalReceipts;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns indexer JSON bodies into domain receipts. Events responses have the shape
 * {@code {"data":{"block":[{"txid":"..","events":[..]}]}}}; a missing {@code data} or {@code block}
 * means the block has no events.
 */
@Component
@RequiredArgsConstructor
public class IndexerResponseParser {

    private static final String MAINNET = "mainnet";

    private final ObjectMapper objectMapper;

    public Receipts parseReceipts(ProtocolId protocol, String json) {
        JsonNode transactions = readTree(json, "block events").path("data").path("block");
        if (transactions.isMissingNode() || transactions.isNull()) {
            return emptyReceipts(protocol);
        }
        if (!transactions.isArray()) {
            throw new SchemaException("data.block is not an array");
        }
        return switch (protocol) {
            case ORDINAL -> parseOrdinal(transactions);
            case BRC20 -> parseBrc20(transactions);
        };
    }

    public NodeInfo parseNodeInfo(String json) {
        JsonNode chainInfo = readTree(json, "node info").path("data").path("chainInfo");
        String network = chainInfo.path("network").asText(null);
        if (network == null || network.isBlank()) {
            throw new SchemaException("node info has no data.chainInfo.network");
        }
        JsonNode height = chainInfo.path("ordBlockHeight");
        return new NodeInfo(normalizeNetwork(network), parseHeight(height));
    }

    /**
     * Block hash bodies are plain text; surrounding whitespace and quotes are stripped.
     */
    public String parseBlockHash(String body, long height) {
        String hash = body == null ? "" : body.trim();
        if (hash.length() >= 2 && hash.startsWith("\"") && hash.endsWith("\"")) {
            hash = hash.substring(1, hash.length() - 1);
        }
        if (hash.isEmpty()) {
            throw new SchemaException("empty block hash for height " + height);
        }
        return hash;
    }

    static String normalizeNetwork(String network) {
        String lower = network.trim().toLowerCase(Locale.ROOT);
        return MAINNET.equals(lower) ? "bitcoin" : lower;
    }

    private OrdinalReceipts parseOrdinal(JsonNode transactions) {
        List<OrdinalEvent> events = new ArrayList<>();
        for (JsonNode tx : transactions) {
            String txid = tx.path("txid").asText(null);
            for (JsonNode event : tx.path("events")) {
                String inscriptionId = textOrNull(event, "inscriptionId");
                if (inscriptionId == null) {
                    throw new SchemaException("ordinal event without inscriptionId in tx " + txid);
                }
                String owner = event.path("to").path("address").asText(null);
                if (owner == null) {
                    owner = textOrNull(event, "owner");
                }
                JsonNode seq = event.path("sequenceNumber");
                events.add(new OrdinalEvent(
                        txid,
                        inscriptionId,
                        textOrNull(event, "type"),
                        owner,
                        textOrNull(event, "contentHash"),
                        seq.isMissingNode() || seq.isNull() ? null : parseLong(seq, "sequenceNumber")));
            }
        }
        return new OrdinalReceipts(events);
    }

    private Brc20Receipts parseBrc20(JsonNode transactions) {
        List<Brc20Entry> entries = new ArrayList<>();
        for (JsonNode tx : transactions) {
            String txid = tx.path("txid").asText(null);
            for (JsonNode event : tx.path("events")) {
                if (event.has("valid") && !event.path("valid").asBoolean(true)) {
                    continue;
                }
                String tick = textOrNull(event, "tick");
                if (tick == null) {
                    throw new SchemaException("brc20 event without tick in tx " + txid);
                }
                entries.add(new Brc20Entry(
                        txid,
                        tick.toLowerCase(Locale.ROOT),
                        operationOf(textOrNull(event, "type"), txid),
                        amountOf(event.path("amount"), txid),
                        event.path("from").path("address").asText(null),
                        event.path("to").path("address").asText(null),
                        textOrNull(event, "inscriptionId")));
            }
        }
        return new Brc20Receipts(entries);
    }

    private static Brc20Operation operationOf(String type, String txid) {
        if (type == null) {
            throw new SchemaException("brc20 event without type in tx " + txid);
        }
        return switch (type) {
            case "deploy" -> Brc20Operation.DEPLOY;
            case "mint", "inscribeMint" -> Brc20Operation.MINT;
            case "inscribeTransfer" -> Brc20Operation.INSCRIBE_TRANSFER;
            case "transfer" -> Brc20Operation.TRANSFER;
            case "burn" -> Brc20Operation.BURN;
            default -> throw new SchemaException("unknown brc20 event type '" + type + "' in tx " + txid);
        };
    }

    private static BigDecimal amountOf(JsonNode amount, String txid) {
        if (amount.isMissingNode() || amount.isNull()) {
            return null;
        }
        String text = amount.asText();
        if (text.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new SchemaException("non-numeric brc20 amount '" + text + "' in tx " + txid, e);
        }
    }

    private static long parseHeight(JsonNode height) {
        if (height.isMissingNode() || height.isNull()) {
            throw new SchemaException("node info has no data.chainInfo.ordBlockHeight");
        }
        return parseLong(height, "ordBlockHeight");
    }

    private static long parseLong(JsonNode node, String field) {
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new SchemaException("non-numeric " + field + ": " + node, e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static Receipts emptyReceipts(ProtocolId protocol) {
        return switch (protocol) {
            case ORDINAL -> OrdinalReceipts.empty();
            case BRC20 -> Brc20Receipts.empty();
        };
    }

    private JsonNode readTree(String json, String what) {
        if (json == null || json.isBlank()) {
            throw new SchemaException("empty " + what + " response");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SchemaException("unparseable " + what + " response", e);
        }
    }
}
