package kmsjwt.adapter.in.dto;

public record IssueTokenResponse(String token) {}
