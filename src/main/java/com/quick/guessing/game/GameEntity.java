package com.quick.guessing.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turn-based state machine for one game session.
 *
 * <p>Every request is serialized through the entity lock. Guards are evaluated before any
 * state is written, so a rejected request leaves both the game and its players untouched.
 * While handling {@link #play} the game calls into {@link PlayerEntity} handles; players
 * never call back into a game, so the lock order is always game then player.
 */
public class GameEntity extends Entity {

    private static final Logger log = LoggerFactory.getLogger(GameEntity.class);

    private final Game game = new Game();
    private final PlayerRegistry playerRegistry;
    private final NumberSource numbers;
    private final Configuration defaults;

    public GameEntity(String host, String name, ServerContext context) {
        super(context.getCallTimeout());
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host name is required");
        }
        this.playerRegistry = context.getPlayers();
        this.numbers = context.getNumbers();
        this.defaults = context.getDefaults();
        game.setHost(host);
        game.setName(name == null || name.isBlank() ? host : name);
        game.getPlayers().add(host);
        game.setConfig(defaults);
    }

    @Override
    public String id() {
        return game.getHost();
    }

    public String host() {
        return game.getHost();
    }

    public GameInfo info() {
        return call(this::snapshot);
    }

    public List<String> players() {
        return call(() -> List.copyOf(game.getPlayers()));
    }

    public Result<Role> role(String playerName) {
        return call(() -> {
            if (game.getHost().equals(playerName)) {
                return Result.ok(Role.HOST);
            }
            if (game.getPlayers().contains(playerName)) {
                return Result.ok(Role.PLAYER);
            }
            return Result.error(GameError.PLAYER_NOT_FOUND);
        });
    }

    public String summary() {
        return call(() -> game.getHost() + "'s game: " + describeState());
    }

    /**
     * Closes the game and returns the final roster. Requests queued behind this one, such as
     * a late {@link #addPlayer}, fail with {@link EntityUnavailableException}.
     */
    public List<String> end() {
        return call(() -> {
            close();
            log.info("game-close host={} players={}", game.getHost(), game.getPlayers());
            return List.copyOf(game.getPlayers());
        });
    }

    public Result<Void> configure(GameOptions options) {
        return call(() -> {
            if (game.getState() == GameState.IN_PLAY) {
                return reject("configure", GameError.INVALID_ACTION_FOR_STATE);
            }
            if (options == null || !options.isValid()) {
                return reject("configure", GameError.INVALID_CONFIGURATION);
            }
            game.setConfig(options.resolve(defaults));
            log.info("game-configure host={} config={}", game.getHost(), game.getConfig());
            return Result.ok();
        });
    }

    public Result<Void> addPlayer(String playerName) {
        return call(() -> {
            if (game.getState() == GameState.IN_PLAY) {
                return reject("add-player", GameError.INVALID_ACTION_FOR_STATE);
            }
            if (game.getPlayers().contains(playerName)) {
                return reject("add-player", GameError.PLAYER_IN_GAME);
            }
            game.getPlayers().add(playerName);
            log.info("game-join host={} player={} players={}", game.getHost(), playerName, game.getPlayers().size());
            return Result.ok();
        });
    }

    /**
     * Takes a non-host player off the roster. The host cannot be removed; a game without
     * its host is ended instead.
     */
    public Result<Void> removePlayer(String playerName) {
        return call(() -> {
            if (game.getState() == GameState.IN_PLAY || game.getHost().equals(playerName)) {
                return reject("remove-player", GameError.INVALID_ACTION_FOR_STATE);
            }
            if (!game.getPlayers().remove(playerName)) {
                return reject("remove-player", GameError.PLAYER_NOT_FOUND);
            }
            log.info("game-leave host={} player={} players={}", game.getHost(), playerName, game.getPlayers().size());
            return Result.ok();
        });
    }

    public Result<TurnOutcome> start(String caller) {
        return call(() -> {
            if (game.getState() == GameState.IN_PLAY) {
                return reject("start", GameError.INVALID_ACTION_FOR_STATE);
            }
            if (!game.getHost().equals(caller)) {
                return reject("start", GameError.PLAYER_NOT_HOST);
            }
            return Result.ok(begin("start"));
        });
    }

    public Result<TurnOutcome> restart(String caller) {
        return call(() -> {
            if (game.getState() == GameState.SETTING_UP) {
                return reject("restart", GameError.INVALID_ACTION_FOR_STATE);
            }
            if (!game.getHost().equals(caller)) {
                return reject("restart", GameError.PLAYER_NOT_HOST);
            }
            return Result.ok(begin("restart"));
        });
    }

    public Result<TurnOutcome> play(String playerName, int guess) {
        return call(() -> {
            if (game.getState() != GameState.IN_PLAY) {
                return reject("play", GameError.INVALID_ACTION_FOR_STATE);
            }
            if (!game.getTurnOrder().get(game.getTurn()).equals(playerName)) {
                return reject("play", GameError.WRONG_TURN);
            }
            if (!game.getConfig().inRange(guess)) {
                return reject("play", GameError.OUT_OF_RANGE);
            }
            Map<String, PlayerEntity> handles = resolve(game.getTurnOrder());
            scoreTurn(handles, playerName, guess);

            if (game.getTurn() < game.getTurnOrder().size() - 1) {
                game.setTurn(game.getTurn() + 1);
                return Result.ok(TurnOutcome.nextTurn(game.getRound(), game.getTurn(), currentActor()));
            }
            return Result.ok(finishRound(handles));
        });
    }

    private TurnOutcome begin(String action) {
        List<String> order = List.copyOf(game.getPlayers());
        Map<String, PlayerEntity> handles = resolve(order);
        handles.values().forEach(PlayerEntity::reset);
        game.setTurnOrder(order);
        game.setRound(0);
        game.setTurn(0);
        game.setState(GameState.IN_PLAY);
        deal(handles);
        log.info("game-{} host={} players={} config={}", action, game.getHost(), order, game.getConfig());
        return TurnOutcome.nextTurn(0, 0, currentActor());
    }

    private void scoreTurn(Map<String, PlayerEntity> handles, String playerName, int guess) {
        PlayerEntity actor = handles.get(playerName);
        Round round = actor.recordGuess(guess);

        Map<String, Integer> othersAssigned = new LinkedHashMap<>();
        handles.forEach((name, handle) -> {
            if (!name.equals(playerName)) {
                handle.currentRound().ifPresent(r -> othersAssigned.put(name, r.assigned()));
            }
        });
        for (Bonus bonus : ScoringEngine.bonuses(round.assigned(), guess, othersAssigned)) {
            actor.addBonus(bonus);
        }
        int points = actor.closeRound();
        log.debug("turn host={} round={} player={} assigned={} guess={} points={}",
                game.getHost(), game.getRound(), playerName, round.assigned(), guess, points);
    }

    private TurnOutcome finishRound(Map<String, PlayerEntity> handles) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        handles.forEach((name, handle) -> {
            Optional<Round> current = handle.currentRound();
            if (current.isPresent() && current.get().isGuessed() && !current.get().isClosed()) {
                handle.closeRound();
            }
            totals.put(name, handle.totalPoints());
        });

        int best = totals.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (best >= game.getConfig().maxPoints()) {
            game.setState(GameState.ENDED);
            log.info("game-ended host={} round={} totals={}", game.getHost(), game.getRound(), totals);
            return TurnOutcome.ended(game.getRound(), totals);
        }

        game.setRound(game.getRound() + 1);
        game.setTurn(0);
        deal(handles);
        log.info("game-round host={} round={} totals={}", game.getHost(), game.getRound(), totals);
        return TurnOutcome.nextRound(game.getRound(), currentActor(), totals);
    }

    private void deal(Map<String, PlayerEntity> handles) {
        int maxGuess = game.getConfig().maxGuess();
        handles.forEach((name, handle) -> {
            int assigned = numbers.draw(maxGuess);
            if (assigned < 1 || assigned > maxGuess) {
                throw new IllegalStateException("Number source drew " + assigned + " outside [1, " + maxGuess + "]");
            }
            handle.startRound(game.getRound(), assigned);
        });
    }

    /**
     * Looks up every player handle before anything is written, so a missing player aborts
     * the request cleanly.
     */
    private Map<String, PlayerEntity> resolve(List<String> names) {
        Map<String, PlayerEntity> handles = new LinkedHashMap<>();
        for (String name : names) {
            PlayerEntity handle = playerRegistry.lookup(name)
                    .orElseThrow(() -> new EntityUnavailableException("Player " + name + " in game " + game.getHost() + " is not connected"));
            handles.put(name, handle);
        }
        return handles;
    }

    private String currentActor() {
        return game.getTurnOrder().get(game.getTurn());
    }

    private String describeState() {
        return switch (game.getState()) {
            case SETTING_UP -> "Setting up";
            case ENDED -> "Ended";
            case IN_PLAY -> "Round " + game.getRound() + ", " + currentActor() + "'s turn";
        };
    }

    private GameInfo snapshot() {
        return new GameInfo(
                game.getState(),
                game.getHost(),
                game.getName(),
                new ArrayList<>(game.getPlayers()),
                game.getRound(),
                game.getTurn(),
                game.getConfig()
        );
    }

    private <T> Result<T> reject(String action, GameError error) {
        log.debug("game-reject host={} action={} state={} error={}", game.getHost(), action, game.getState(), error);
        return Result.error(error);
    }
}
