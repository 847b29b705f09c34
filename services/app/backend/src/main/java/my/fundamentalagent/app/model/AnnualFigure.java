package my.fundamentalagent.app.model;

public record AnnualFigure(int year, double value) {
}
