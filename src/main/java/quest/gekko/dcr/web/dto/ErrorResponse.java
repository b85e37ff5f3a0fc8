package quest.gekko.dcr.web.dto;

public record ErrorResponse(int status, String error, String path) {}
