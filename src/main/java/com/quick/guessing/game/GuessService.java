package com.quick.guessing.game;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Player-facing verbs of the game server.
 *
 * <p>The service holds no state of its own. Each verb resolves names through the
 * {@link ServerContext} registries, short-circuiting with {@link GameError#PLAYER_NOT_FOUND}
 * or {@link GameError#GAME_NOT_FOUND}, and then delegates to the entities. Expected failures
 * come back as {@link Result} errors; {@link EntityUnavailableException} is left to propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuessService {

    private final ServerContext context;

    /**
     * Registers a player explicitly. Fails with {@link GameError#PLAYER_NAME_TAKEN} while the
     * name is in use.
     */
    public Result<Void> connect(String playerName) {
        if (isBlank(playerName)) {
            return Result.error(GameError.PLAYER_NOT_FOUND);
        }
        if (!context.getPlayers().register(playerName, context.newPlayer(playerName))) {
            return Result.error(GameError.PLAYER_NAME_TAKEN);
        }
        return Result.ok();
    }

    /**
     * Leaves the player's current game, if any, then unregisters the player.
     */
    public Result<Void> disconnect(String playerName) {
        Optional<PlayerEntity> player = context.getPlayers().lookup(playerName);
        if (player.isEmpty()) {
            return Result.error(GameError.PLAYER_NOT_FOUND);
        }
        if (currentGame(playerName).isPresent()) {
            Result<Void> left = leave(playerName);
            if (!left.isOk()) {
                return left;
            }
        }
        context.getPlayers().unregister(playerName, player.get());
        return Result.ok();
    }

    public Result<GameEntity> host(String playerName) {
        return host(playerName, null);
    }

    /**
     * Creates a game hosted by the player, registering the player first if needed.
     *
     * @param gameName display name, defaults to the host's name
     */
    public Result<GameEntity> host(String playerName, String gameName) {
        if (isBlank(playerName)) {
            return Result.error(GameError.PLAYER_NOT_FOUND);
        }
        ensureRegistered(playerName);
        GameEntity game = context.newGame(playerName, gameName);
        if (!context.getPlayers().claimGame(playerName, game)) {
            return Result.error(GameError.PLAYER_IN_GAME);
        }
        if (!context.getGames().register(game.id(), game)) {
            game.close();
            context.getPlayers().releaseGame(playerName, game);
            return Result.error(GameError.PLAYER_IN_GAME);
        }
        log.info("host player={} game={}", playerName, game.id());
        return Result.ok(game);
    }

    public Result<Void> join(String playerName) {
        return join(playerName, null);
    }

    /**
     * Adds the player to the game {@code existingPlayerName} is in, or to the most recently
     * hosted game when no existing player is given.
     *
     * <p>The player's occupancy is claimed before the roster is touched and given back if
     * the game turns the player away.
     */
    public Result<Void> join(String playerName, String existingPlayerName) {
        if (isBlank(playerName)) {
            return Result.error(GameError.PLAYER_NOT_FOUND);
        }
        ensureRegistered(playerName);
        Optional<GameEntity> target;
        if (existingPlayerName == null) {
            target = context.getGames().latest();
        } else {
            if (!context.getPlayers().contains(existingPlayerName)) {
                return Result.error(GameError.PLAYER_NOT_FOUND);
            }
            target = currentGame(existingPlayerName);
        }
        if (target.isEmpty()) {
            return Result.error(GameError.GAME_NOT_FOUND);
        }
        GameEntity game = target.get();
        if (!context.getPlayers().claimGame(playerName, game)) {
            return Result.error(GameError.PLAYER_IN_GAME);
        }
        Result<Void> added;
        try {
            added = game.addPlayer(playerName);
        } catch (EntityUnavailableException e) {
            context.getPlayers().releaseGame(playerName, game);
            throw e;
        }
        if (!added.isOk()) {
            context.getPlayers().releaseGame(playerName, game);
        }
        return added;
    }

    public Result<Void> configure(String hostName, GameOptions options) {
        return hostedGame(hostName).flatMap(game -> game.configure(options));
    }

    public Result<TurnOutcome> start(String playerName) {
        return resolveGame(playerName).flatMap(game -> game.start(playerName));
    }

    public Result<TurnOutcome> play(String playerName, int guess) {
        return resolveGame(playerName).flatMap(game -> game.play(playerName, guess));
    }

    public Result<TurnOutcome> restart(String hostName) {
        return hostedGame(hostName).flatMap(game -> game.restart(hostName));
    }

    /**
     * Takes the player out of their game. A host leaving ends the game for everyone.
     */
    public Result<Void> leave(String playerName) {
        Result<GameEntity> resolved = resolveGame(playerName);
        if (!resolved.isOk()) {
            return Result.error(resolved.error());
        }
        GameEntity game = resolved.value();
        Result<Role> role = game.role(playerName);
        if (!role.isOk()) {
            // claimed, not yet on the roster
            return Result.error(GameError.GAME_NOT_FOUND);
        }
        if (role.value() == Role.HOST) {
            return endGame(playerName);
        }
        Result<Void> removed = game.removePlayer(playerName);
        if (removed.isOk()) {
            context.getPlayers().releaseGame(playerName, game);
        }
        return removed;
    }

    /**
     * Ends the host's game: the game is unregistered and every roster member is freed.
     */
    public Result<Void> endGame(String hostName) {
        Result<GameEntity> resolved = hostedGame(hostName);
        if (!resolved.isOk()) {
            return Result.error(resolved.error());
        }
        GameEntity game = resolved.value();
        List<String> roster = game.end();
        context.getGames().unregister(game.id(), game);
        roster.forEach(player -> context.getPlayers().releaseGame(player, game));
        log.info("end-game host={} players={}", hostName, roster);
        return Result.ok();
    }

    public Result<GameInfo> game(String playerName) {
        return resolveGame(playerName).map(GameEntity::info);
    }

    public Result<PlayerInfo> player(String playerName) {
        return context.getPlayers().lookup(playerName)
                .map(player -> Result.ok(player.info()))
                .orElseGet(() -> Result.error(GameError.PLAYER_NOT_FOUND));
    }

    public List<String> players() {
        return context.getPlayers().list();
    }

    public List<String> games() {
        List<String> summaries = new ArrayList<>();
        for (GameEntity game : context.getGames().entities()) {
            try {
                summaries.add(game.summary());
            } catch (EntityUnavailableException e) {
                log.debug("games skipping host={} reason={}", game.id(), e.getMessage());
            }
        }
        return summaries;
    }

    public ServerInfo info() {
        return new ServerInfo(players(), games());
    }

    /**
     * Disconnects every player and ends every game.
     */
    public Result<Void> reset() {
        context.clear();
        log.info("server-reset");
        return Result.ok();
    }

    private PlayerEntity ensureRegistered(String playerName) {
        return context.getPlayers().registerIfAbsent(playerName, context::newPlayer);
    }

    private Optional<GameEntity> currentGame(String playerName) {
        return context.getPlayers().gameOf(playerName);
    }

    private static boolean isBlank(String playerName) {
        return playerName == null || playerName.isBlank();
    }

    private Result<GameEntity> resolveGame(String playerName) {
        if (!context.getPlayers().contains(playerName)) {
            return Result.error(GameError.PLAYER_NOT_FOUND);
        }
        Optional<GameEntity> game = currentGame(playerName);
        if (game.isEmpty()) {
            return Result.error(GameError.GAME_NOT_FOUND);
        }
        return Result.ok(game.get());
    }

    private Result<GameEntity> hostedGame(String hostName) {
        Result<GameEntity> resolved = resolveGame(hostName);
        if (!resolved.isOk()) {
            return resolved;
        }
        Result<Role> role = resolved.value().role(hostName);
        if (!role.isOk() || role.value() != Role.HOST) {
            return Result.error(GameError.PLAYER_NOT_HOST);
        }
        return resolved;
    }
}
