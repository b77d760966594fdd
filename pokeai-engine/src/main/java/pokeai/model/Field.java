package pokeai.model;

import pokeai.data.Terrain;
import pokeai.data.Weather;

/**
 * Weather and terrain shared by both sides. A permanent condition has no countdown and lasts
 * until replaced.
 */
public class Field {
    private Weather weather = Weather.NONE;
    private int weatherTurns;
    private boolean weatherPermanent;
    private Terrain terrain = Terrain.NONE;
    private int terrainTurns;
    private boolean terrainPermanent;

    public Field copy() {
        Field copy = new Field();
        copy.weather = weather;
        copy.weatherTurns = weatherTurns;
        copy.weatherPermanent = weatherPermanent;
        copy.terrain = terrain;
        copy.terrainTurns = terrainTurns;
        copy.terrainPermanent = terrainPermanent;
        return copy;
    }

    public Weather getWeather() {
        return weather == null ? Weather.NONE : weather;
    }

    public int getWeatherTurns() {
        return weatherTurns;
    }

    public boolean isWeatherPermanent() {
        return weatherPermanent;
    }

    public void setWeather(Weather weather, int turns, boolean permanent) {
        this.weather = weather;
        this.weatherPermanent = weather != Weather.NONE && permanent;
        this.weatherTurns = weather == Weather.NONE || permanent ? 0 : turns;
    }

    public void clearWeather() {
        setWeather(Weather.NONE, 0, false);
    }

    /** Counts the weather down one turn; returns true when it ended. */
    public boolean tickWeather() {
        if (getWeather() == Weather.NONE || weatherPermanent) {
            return false;
        }
        weatherTurns = Math.max(0, weatherTurns - 1);
        if (weatherTurns == 0) {
            clearWeather();
            return true;
        }
        return false;
    }

    public Terrain getTerrain() {
        return terrain == null ? Terrain.NONE : terrain;
    }

    public int getTerrainTurns() {
        return terrainTurns;
    }

    public boolean isTerrainPermanent() {
        return terrainPermanent;
    }

    public void setTerrain(Terrain terrain, int turns, boolean permanent) {
        this.terrain = terrain;
        this.terrainPermanent = terrain != Terrain.NONE && permanent;
        this.terrainTurns = terrain == Terrain.NONE || permanent ? 0 : turns;
    }

    public void clearTerrain() {
        setTerrain(Terrain.NONE, 0, false);
    }

    public boolean tickTerrain() {
        if (getTerrain() == Terrain.NONE || terrainPermanent) {
            return false;
        }
        terrainTurns = Math.max(0, terrainTurns - 1);
        if (terrainTurns == 0) {
            clearTerrain();
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "weather=" + getWeather() + " terrain=" + getTerrain();
    }
}
