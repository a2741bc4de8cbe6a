package com.secondhand.host;

public interface WeatherService {

    WeatherCondition currentWeather();
}
