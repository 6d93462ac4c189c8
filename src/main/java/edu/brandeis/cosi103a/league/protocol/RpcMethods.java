package edu.brandeis.cosi103a.league.protocol;

/**
 * JSON-RPC method names understood by each agent role.
 */
public final class RpcMethods {

    private RpcMethods() {}

    // League manager
    public static final String REGISTER_PLAYER = "register_player";
    public static final String REGISTER_REFEREE = "register_referee";
    public static final String START_LEAGUE = "start_league";
    public static final String REPORT_MATCH_RESULT = "report_match_result";
    public static final String GET_STANDINGS = "get_standings";
    public static final String GET_LEAGUE_STATUS = "get_league_status";

    // Referee
    public static final String ASSIGN_MATCH = "assign_match";

    // Player
    public static final String HANDLE_GAME_INVITATION = "handle_game_invitation";
    public static final String CHOOSE_PARITY = "choose_parity";
    public static final String NOTIFY_MATCH_RESULT = "notify_match_result";
    public static final String NOTIFY_TOURNAMENT_START = "notify_tournament_start";
    public static final String NOTIFY_ROUND_ANNOUNCEMENT = "notify_round_announcement";
    public static final String NOTIFY_ROUND_COMPLETED = "notify_round_completed";
    public static final String NOTIFY_TOURNAMENT_END = "notify_tournament_end";
}
