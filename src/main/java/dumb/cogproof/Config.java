package dumb.cogproof;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.cogproof.cache.ProofCache;
import dumb.cogproof.modal.ModalSystem;
import dumb.cogproof.modal.Tableaux;
import dumb.cogproof.route.RouteConfig;
import dumb.cogproof.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.cogproof.util.Log.message;

/**
 * Settings of a {@link CogProof} instance. Missing JSON fields take their defaults; a prover path
 * left null keeps that prover out of the registry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Config(
        @JsonProperty("cacheCapacity") int cacheCapacity,
        @JsonProperty("cachePath") @Nullable String cachePath,
        @JsonProperty("maxDepth") int maxDepth,
        @JsonProperty("timeoutMs") long timeoutMs,
        @JsonProperty("modalSystem") ModalSystem modalSystem,
        @JsonProperty("race") boolean race,
        @JsonProperty("raceWidth") int raceWidth,
        @JsonProperty("maxWorlds") int maxWorlds,
        @JsonProperty("z3") @Nullable String z3,
        @JsonProperty("cvc5") @Nullable String cvc5,
        @JsonProperty("lean") @Nullable String lean,
        @JsonProperty("coq") @Nullable String coq,
        @JsonProperty("neural") boolean neural,
        @JsonProperty("llmApiUrl") String llmApiUrl,
        @JsonProperty("llmModel") String llmModel
) {
    public static final String DEFAULT_LLM_URL = "http://localhost:11434";
    public static final String DEFAULT_LLM_MODEL = "hf.co/bartowski/Meta-Llama-3.1-8B-Instruct-GGUF:Q8_0";

    @JsonCreator
    public Config(
            @JsonProperty("cacheCapacity") Integer cacheCapacity,
            @JsonProperty("cachePath") @Nullable String cachePath,
            @JsonProperty("maxDepth") Integer maxDepth,
            @JsonProperty("timeoutMs") Long timeoutMs,
            @JsonProperty("modalSystem") ModalSystem modalSystem,
            @JsonProperty("race") Boolean race,
            @JsonProperty("raceWidth") Integer raceWidth,
            @JsonProperty("maxWorlds") Integer maxWorlds,
            @JsonProperty("z3") @Nullable String z3,
            @JsonProperty("cvc5") @Nullable String cvc5,
            @JsonProperty("lean") @Nullable String lean,
            @JsonProperty("coq") @Nullable String coq,
            @JsonProperty("neural") Boolean neural,
            @JsonProperty("llmApiUrl") String llmApiUrl,
            @JsonProperty("llmModel") String llmModel
    ) {
        this(
                cacheCapacity != null ? cacheCapacity : ProofCache.DEFAULT_CAPACITY,
                cachePath,
                maxDepth != null ? maxDepth : RouteConfig.DEFAULT.maxDepth(),
                timeoutMs != null ? timeoutMs : RouteConfig.DEFAULT.timeoutMs(),
                modalSystem != null ? modalSystem : RouteConfig.DEFAULT.modalSystem(),
                race != null ? race : RouteConfig.DEFAULT.race(),
                raceWidth != null ? raceWidth : RouteConfig.DEFAULT.raceWidth(),
                maxWorlds != null ? maxWorlds : Tableaux.DEFAULT_MAX_WORLDS,
                z3, cvc5, lean, coq,
                neural != null && neural,
                llmApiUrl != null ? llmApiUrl : DEFAULT_LLM_URL,
                llmModel != null ? llmModel : DEFAULT_LLM_MODEL
        );
    }

    public Config() {
        this(ProofCache.DEFAULT_CAPACITY, null, RouteConfig.DEFAULT.maxDepth(), RouteConfig.DEFAULT.timeoutMs(),
                RouteConfig.DEFAULT.modalSystem(), RouteConfig.DEFAULT.race(), RouteConfig.DEFAULT.raceWidth(),
                Tableaux.DEFAULT_MAX_WORLDS, null, null, null, null, false, DEFAULT_LLM_URL, DEFAULT_LLM_MODEL);
    }

    /** Reads a JSON configuration file; a missing file gives the defaults. */
    public static Config load(Path file) throws IOException {
        if (!Files.exists(file)) {
            message("No configuration at " + file + ", using defaults");
            return new Config();
        }
        return Json.read(file, Config.class);
    }

    public RouteConfig route() {
        return new RouteConfig(maxDepth, timeoutMs, modalSystem, null, race, raceWidth);
    }
}
