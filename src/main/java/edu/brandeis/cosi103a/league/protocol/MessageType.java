package edu.brandeis.cosi103a.league.protocol;

/**
 * Values of the envelope's {@code message_type} field.
 */
public enum MessageType {
    LEAGUE_REGISTER_REQUEST,
    LEAGUE_REGISTER_RESPONSE,
    REFEREE_REGISTER_REQUEST,
    REFEREE_REGISTER_RESPONSE,
    TOURNAMENT_START,
    ROUND_ANNOUNCEMENT,
    MATCH_ASSIGNMENT,
    GAME_INVITATION,
    GAME_JOIN_ACK,
    CHOOSE_PARITY_CALL,
    CHOOSE_PARITY_RESPONSE,
    GAME_OVER,
    MATCH_RESULT_REPORT,
    MATCH_RESULT_ACK,
    ROUND_COMPLETED,
    TOURNAMENT_END,
    LEAGUE_QUERY,
    LEAGUE_QUERY_RESPONSE,
    ACK
}
